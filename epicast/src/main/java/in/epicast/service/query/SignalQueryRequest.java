package in.epicast.service.query;

import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeValue;
import in.epicast.service.params.FilterParser;
import in.epicast.service.params.RequestParameters;

import java.util.List;

/**
 * Validated filters and revision selection of one query request.
 */
public record SignalQueryRequest(
    List<SourceSignalPair> sourceSignals,
    List<GeoPair> geos,
    List<TimePair> times,
    RevisionSelection revision
) {
    public SignalQueryRequest {
        sourceSignals = List.copyOf(sourceSignals);
        geos = List.copyOf(geos);
        times = List.copyOf(times);
    }

    /**
     * @throws in.epicast.domain.common.ValidationFailedException on missing or malformed parameters
     */
    public static SignalQueryRequest parse(RequestParameters params) {
        List<SourceSignalPair> sourceSignals = FilterParser.parseSourceSignalPairs(params);
        List<GeoPair> geos = FilterParser.parseGeoPairs(params);
        List<TimePair> times = FilterParser.parseTimePairs(params);
        List<TimeValue> issues = FilterParser.extractDates(params, "issues");
        Integer lag = FilterParser.extractInteger(params, "lag");
        Integer asOf = FilterParser.extractDate(params, "as_of");
        return new SignalQueryRequest(sourceSignals, geos, times, new RevisionSelection(issues, lag, asOf));
    }
}
