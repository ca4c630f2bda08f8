package in.epicast.service.query;

import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.filter.TimeValue;
import in.epicast.service.params.FilterParser;
import in.epicast.service.params.RequestParameters;
import in.epicast.util.TimeValues;

import java.util.List;

/**
 * Validated parameters of one trend request: filters, the day window to read,
 * the anchor day and the basis day.
 */
public record TrendRequest(
    List<SourceSignalPair> sourceSignals,
    List<GeoPair> geos,
    TimeValue window,
    int date,
    int basis
) {
    public static final int DEFAULT_BASIS_SHIFT_DAYS = -7;

    public TrendRequest {
        sourceSignals = List.copyOf(sourceSignals);
        geos = List.copyOf(geos);
    }

    /**
     * {@code date} defaults to the end of the window and {@code basis} to seven
     * days before the anchor.
     *
     * @throws in.epicast.domain.common.ValidationFailedException on missing or malformed parameters
     */
    public static TrendRequest parse(RequestParameters params) {
        List<SourceSignalPair> sourceSignals = FilterParser.parseSourceSignalPairs(params);
        List<GeoPair> geos = FilterParser.parseGeoPairs(params);
        TimeValue window = FilterParser.parseDayRangeArg(params, "window");
        Integer date = FilterParser.extractDate(params, "date");
        int anchor = date != null ? date : window.end();
        Integer basis = FilterParser.extractDate(params, "basis");
        if (basis == null) {
            basis = TimeValues.shiftDays(anchor, DEFAULT_BASIS_SHIFT_DAYS);
        }
        return new TrendRequest(sourceSignals, geos, window, anchor, basis);
    }

    public List<TimePair> times() {
        return List.of(TimePair.of(TimeType.DAY, List.of(window)));
    }
}
