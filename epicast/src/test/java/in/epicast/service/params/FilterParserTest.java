package in.epicast.service.params;

import in.epicast.domain.common.ValidationFailedException;
import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.filter.TimeValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for filter and revision parameter parsing.
 */
class FilterParserTest {

    @Test
    void parseSourceSignalPairs_combinedEncoding() {
        RequestParameters params = RequestParameters.of("signal", "src1:sig1,sig2;src2:*");

        List<SourceSignalPair> pairs = FilterParser.parseSourceSignalPairs(params);

        assertEquals(2, pairs.size());
        assertEquals(SourceSignalPair.of("src1", "sig1", "sig2"), pairs.get(0));
        assertTrue(pairs.get(1).allSignals());
        assertEquals("src2", pairs.get(1).source());
    }

    @Test
    void parseSourceSignalPairs_repeatedParameterIsMerged() {
        RequestParameters params = RequestParameters.of("signal", "src1:sig1", "signal", "src2:sig2");

        List<SourceSignalPair> pairs = FilterParser.parseSourceSignalPairs(params);

        assertEquals(List.of(SourceSignalPair.of("src1", "sig1"), SourceSignalPair.of("src2", "sig2")), pairs);
    }

    @Test
    void parseSourceSignalPairs_legacyEncoding() {
        RequestParameters params = RequestParameters.of("data_source", "src1", "signals", "a, b,a");

        List<SourceSignalPair> pairs = FilterParser.parseSourceSignalPairs(params);

        assertEquals(List.of(SourceSignalPair.of("src1", "a", "b")), pairs);
    }

    @Test
    void parseSourceSignalPairs_legacyWildcard() {
        RequestParameters params = RequestParameters.of("data_source", "src1", "signal", "*");

        assertEquals(List.of(SourceSignalPair.all("src1")), FilterParser.parseSourceSignalPairs(params));
    }

    @Test
    void parseSourceSignalPairs_missingBothEncodingsFails() {
        ValidationFailedException e = assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseSourceSignalPairs(RequestParameters.of("geo", "state:ca")));

        assertTrue(e.getMessage().contains("signal"));
    }

    @Test
    void parseSourceSignalPairs_partialLegacyFails() {
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseSourceSignalPairs(RequestParameters.of("data_source", "src1")));
    }

    @Test
    void parseSourceSignalPairs_entryWithoutValuesFails() {
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseSourceSignalPairs(RequestParameters.of("signal", "src1:")));
    }

    @Test
    void parseGeoPairs_combinedEncoding() {
        List<GeoPair> pairs = FilterParser.parseGeoPairs(RequestParameters.of("geo", "county:*;state:ca,ny"));

        assertEquals(List.of(GeoPair.all("county"), GeoPair.of("state", List.of("ca", "ny"))), pairs);
    }

    @Test
    void parseGeoPairs_legacyEncoding() {
        RequestParameters params = RequestParameters.of("geo_type", "state", "geo_values", "ca,ny");

        assertEquals(List.of(GeoPair.of("state", List.of("ca", "ny"))), FilterParser.parseGeoPairs(params));
    }

    @Test
    void parseGeoPairs_missingFails() {
        ValidationFailedException e = assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseGeoPairs(RequestParameters.of("signal", "a:b")));

        assertTrue(e.getMessage().contains("geo"));
    }

    @Test
    void parseTimePairs_compactDaysAndWeeks() {
        RequestParameters params = RequestParameters.of("time", "day:20200101-20200110,20200115;week:202001-202005");

        List<TimePair> pairs = FilterParser.parseTimePairs(params);

        assertEquals(2, pairs.size());
        assertEquals(TimeType.DAY, pairs.get(0).timeType());
        assertEquals(List.of(TimeValue.range(20200101, 20200110), TimeValue.point(20200115)),
            pairs.get(0).timeValues());
        assertEquals(TimeType.WEEK, pairs.get(1).timeType());
        assertEquals(List.of(TimeValue.range(202001, 202005)), pairs.get(1).timeValues());
    }

    @Test
    void parseTimePairs_isoRange() {
        List<TimePair> pairs = FilterParser.parseTimePairs(RequestParameters.of("time", "day:2020-01-01--2020-01-10"));

        assertEquals(List.of(TimeValue.range(20200101, 20200110)), pairs.get(0).timeValues());
    }

    @Test
    void parseTimePairs_wildcard() {
        List<TimePair> pairs = FilterParser.parseTimePairs(RequestParameters.of("time", "week:*"));

        assertEquals(List.of(TimePair.all(TimeType.WEEK)), pairs);
    }

    @Test
    void parseTimePairs_reversedRangeFails() {
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseTimePairs(RequestParameters.of("time", "day:20200110-20200101")));
    }

    @Test
    void parseTimePairs_invalidCalendarDateFails() {
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseTimePairs(RequestParameters.of("time", "day:20200230")));
    }

    @Test
    void parseTimePairs_unknownTimeTypeFails() {
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseTimePairs(RequestParameters.of("time", "month:202001")));
    }

    @Test
    void parseTimePairs_legacyRequiresAllParameters() {
        ValidationFailedException e = assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseTimePairs(RequestParameters.of("time_type", "day")));

        assertEquals("missing parameter: need [time_values]", e.getMessage());
    }

    @Test
    void parseTimePairs_legacyEncoding() {
        RequestParameters params = RequestParameters.of("time_type", "day", "time_values", "20200101,20200105-20200107");

        List<TimePair> pairs = FilterParser.parseTimePairs(params);

        assertEquals(List.of(TimePair.of(TimeType.DAY,
            List.of(TimeValue.point(20200101), TimeValue.range(20200105, 20200107)))), pairs);
    }

    @Test
    void extractDates_issuesList() {
        RequestParameters params = RequestParameters.of("issues", "20200101-20200105,2020-01-10");

        assertEquals(List.of(TimeValue.range(20200101, 20200105), TimeValue.point(20200110)),
            FilterParser.extractDates(params, "issues"));
        assertNull(FilterParser.extractDates(params, "missing"));
    }

    @Test
    void extractDate_rejectsRange() {
        RequestParameters params = RequestParameters.of("as_of", "20200101-20200105");

        assertThrows(ValidationFailedException.class, () -> FilterParser.extractDate(params, "as_of"));
    }

    @Test
    void extractInteger_parsesAndValidates() {
        assertEquals(3, FilterParser.extractInteger(RequestParameters.of("lag", " 3 "), "lag"));
        assertNull(FilterParser.extractInteger(RequestParameters.of(), "lag"));
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.extractInteger(RequestParameters.of("lag", "three"), "lag"));
    }

    @Test
    void parseDayRangeArg_requiresValue() {
        assertEquals(TimeValue.range(20200401, 20200430),
            FilterParser.parseDayRangeArg(RequestParameters.of("window", "20200401-20200430"), "window"));
        assertThrows(ValidationFailedException.class,
            () -> FilterParser.parseDayRangeArg(RequestParameters.of(), "window"));
    }
}
