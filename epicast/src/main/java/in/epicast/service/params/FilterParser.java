package in.epicast.service.params;

import in.epicast.domain.common.ValidationFailedException;
import in.epicast.domain.filter.GeoPair;
import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.filter.TimePair;
import in.epicast.domain.filter.TimeType;
import in.epicast.domain.filter.TimeValue;
import in.epicast.util.TimeValues;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

/**
 * Parses source/signal, geography, time and revision filters out of request
 * parameters.
 *
 * Two encodings are accepted for each filter:
 * <pre>
 * combined: signal=src1:sig1,sig2;src2:*   geo=county:*;state:ca,ny   time=day:20200101-20200110
 * legacy:   data_source=src1&amp;signals=sig1,sig2   geo_type=state&amp;geo_values=ca   time_type=day&amp;time_values=...
 * </pre>
 * A value list consisting of the single token {@code *} matches everything.
 */
public final class FilterParser {

    public static final String WILDCARD = "*";

    private static final Pattern COMPACT_DAY = Pattern.compile("\\d{8}");
    private static final Pattern COMPACT_WEEK = Pattern.compile("\\d{6}");
    private static final Pattern ISO_DAY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern COMPACT_RANGE = Pattern.compile("(\\d{6}|\\d{8})-(\\d{6}|\\d{8})");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private FilterParser() {}

    // ───────────────────────────────────────────────────────────────
    // Source / signal
    // ───────────────────────────────────────────────────────────────

    public static List<SourceSignalPair> parseSourceSignalPairs(RequestParameters params) {
        String dataSource = params.get("data_source");
        if (dataSource != null && !dataSource.isBlank()) {
            requireAny(params, false, "signal", "signals");
            List<String> signals = extractStrings(params, "signals", "signal");
            if (isWildcard(signals)) {
                return List.of(SourceSignalPair.all(dataSource.trim()));
            }
            return List.of(SourceSignalPair.of(dataSource.trim(), signals));
        }

        if (!containsColon(params, "signal")) {
            throw new ValidationFailedException("missing parameter: signal or (data_source and signal[s])");
        }
        return parseSourceSignalArg(String.join(";", params.getAll("signal")));
    }

    public static List<SourceSignalPair> parseSourceSignalArg(String value) {
        return parseCombined("signal", value, (source, values) ->
            isWildcard(values) ? SourceSignalPair.all(source) : SourceSignalPair.of(source, values));
    }

    // ───────────────────────────────────────────────────────────────
    // Geography
    // ───────────────────────────────────────────────────────────────

    public static List<GeoPair> parseGeoPairs(RequestParameters params) {
        String geoType = params.get("geo_type");
        if (geoType != null && !geoType.isBlank()) {
            requireAny(params, true, "geo_value", "geo_values");
            List<String> geoValues = extractStrings(params, "geo_values", "geo_value");
            if (isWildcard(geoValues)) {
                return List.of(GeoPair.all(geoType.trim()));
            }
            return List.of(GeoPair.of(geoType.trim(), geoValues));
        }

        if (!containsColon(params, "geo")) {
            throw new ValidationFailedException("missing parameter: geo or (geo_type and geo_value[s])");
        }
        return parseGeoArg(String.join(";", params.getAll("geo")));
    }

    public static List<GeoPair> parseGeoArg(String value) {
        return parseCombined("geo", value, (geoType, values) ->
            isWildcard(values) ? GeoPair.all(geoType) : GeoPair.of(geoType, values));
    }

    // ───────────────────────────────────────────────────────────────
    // Time
    // ───────────────────────────────────────────────────────────────

    public static List<TimePair> parseTimePairs(RequestParameters params) {
        String timeType = params.get("time_type");
        if (timeType != null && !timeType.isBlank()) {
            requireAll(params, "time_type", "time_values");
            TimeType type = parseTimeType(timeType);
            List<String> tokens = extractStrings(params, "time_values");
            if (isWildcard(tokens)) {
                return List.of(TimePair.all(type));
            }
            return List.of(TimePair.of(type, parseTimeValues(type, tokens, "time_values")));
        }

        if (!containsColon(params, "time")) {
            throw new ValidationFailedException("missing parameter: time or (time_type and time_values)");
        }
        return parseTimeArg(String.join(";", params.getAll("time")));
    }

    public static List<TimePair> parseTimeArg(String value) {
        return parseCombined("time", value, (type, tokens) -> {
            TimeType timeType = parseTimeType(type);
            if (isWildcard(tokens)) {
                return TimePair.all(timeType);
            }
            return TimePair.of(timeType, parseTimeValues(timeType, tokens, "time"));
        });
    }

    // ───────────────────────────────────────────────────────────────
    // Revision and trend parameters
    // ───────────────────────────────────────────────────────────────

    /**
     * Single day parameter, or null when absent.
     */
    public static Integer extractDate(RequestParameters params, String name) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        TimeValue value = parseTimeValue(TimeType.DAY, raw.trim(), name);
        if (value.isRange()) {
            throw new ValidationFailedException("expected a single date for parameter " + name + ", got: " + raw);
        }
        return value.start();
    }

    /**
     * List of days and day ranges, or null when absent.
     */
    public static List<TimeValue> extractDates(RequestParameters params, String name) {
        if (!params.hasValue(name)) {
            return null;
        }
        return parseTimeValues(TimeType.DAY, extractStrings(params, name), name);
    }

    /**
     * Integer parameter, or null when absent.
     */
    public static Integer extractInteger(RequestParameters params, String name) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim();
        if (!INTEGER.matcher(v).matches()) {
            throw new ValidationFailedException("expected an integer for parameter " + name + ", got: " + raw);
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ValidationFailedException("integer out of range for parameter " + name + ": " + raw, e);
        }
    }

    /**
     * Required day or day range.
     */
    public static TimeValue parseDayRangeArg(RequestParameters params, String name) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) {
            throw new ValidationFailedException("missing parameter: " + name);
        }
        return parseTimeValue(TimeType.DAY, raw.trim(), name);
    }

    public static void requireAll(RequestParameters params, String... names) {
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!params.hasValue(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationFailedException("missing parameter: need [" + String.join(", ", missing) + "]");
        }
    }

    public static void requireAny(RequestParameters params, boolean allowEmpty, String... names) {
        for (String name : names) {
            if (allowEmpty ? params.has(name) : params.hasValue(name)) {
                return;
            }
        }
        throw new ValidationFailedException("missing parameter: need one of [" + String.join(", ", names) + "]");
    }

    // ───────────────────────────────────────────────────────────────
    // Helpers
    // ───────────────────────────────────────────────────────────────

    static <T> List<T> parseCombined(String param, String value, BiFunction<String, List<String>, T> factory) {
        List<T> pairs = new ArrayList<>();
        for (String entry : value.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon <= 0) {
                throw new ValidationFailedException("invalid " + param + " entry '" + trimmed + "', expected key:value1,value2");
            }
            String key = trimmed.substring(0, colon).trim();
            List<String> values = splitList(trimmed.substring(colon + 1));
            if (values.isEmpty()) {
                throw new ValidationFailedException("invalid " + param + " entry '" + trimmed + "', no values given");
            }
            pairs.add(factory.apply(key, values));
        }
        if (pairs.isEmpty()) {
            throw new ValidationFailedException("missing parameter: " + param);
        }
        return pairs;
    }

    static List<TimeValue> parseTimeValues(TimeType type, List<String> tokens, String param) {
        List<TimeValue> values = new ArrayList<>();
        for (String token : tokens) {
            values.add(parseTimeValue(type, token, param));
        }
        return values;
    }

    static TimeValue parseTimeValue(TimeType type, String token, String param) {
        try {
            int doubleDash = token.indexOf("--");
            if (doubleDash > 0) {
                return TimeValue.range(
                    parseTimePoint(type, token.substring(0, doubleDash).trim()),
                    parseTimePoint(type, token.substring(doubleDash + 2).trim()));
            }
            if (COMPACT_RANGE.matcher(token).matches()) {
                int dash = token.indexOf('-');
                return TimeValue.range(
                    parseTimePoint(type, token.substring(0, dash)),
                    parseTimePoint(type, token.substring(dash + 1)));
            }
            return TimeValue.point(parseTimePoint(type, token));
        } catch (IllegalArgumentException e) {
            throw new ValidationFailedException("invalid " + type.code() + " value for parameter " + param + ": "
                + token + " (" + e.getMessage() + ")", e);
        }
    }

    static int parseTimePoint(TimeType type, String token) {
        if (type == TimeType.WEEK) {
            if (!COMPACT_WEEK.matcher(token).matches()) {
                throw new IllegalArgumentException("expected YYYYWW");
            }
            int value = Integer.parseInt(token);
            int week = value % 100;
            if (week < 1 || week > 53) {
                throw new IllegalArgumentException("week out of range");
            }
            return value;
        }
        int value;
        if (COMPACT_DAY.matcher(token).matches()) {
            value = Integer.parseInt(token);
        } else if (ISO_DAY.matcher(token).matches()) {
            value = Integer.parseInt(token.replace("-", ""));
        } else {
            throw new IllegalArgumentException("expected YYYYMMDD or YYYY-MM-DD");
        }
        if (!TimeValues.isValidDay(value)) {
            throw new IllegalArgumentException("not a calendar date");
        }
        return value;
    }

    static TimeType parseTimeType(String value) {
        TimeType type = TimeType.fromCode(value);
        if (type == null) {
            throw new ValidationFailedException("invalid time type: " + value + " (expected day or week)");
        }
        return type;
    }

    private static List<String> extractStrings(RequestParameters params, String... names) {
        for (String name : names) {
            if (params.has(name)) {
                List<String> out = new ArrayList<>();
                for (String raw : params.getAll(name)) {
                    out.addAll(splitList(raw));
                }
                return out;
            }
        }
        return List.of();
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split(",")) {
            String v = part.trim();
            if (!v.isEmpty()) {
                out.add(v);
            }
        }
        return out;
    }

    private static boolean isWildcard(List<String> values) {
        return values.size() == 1 && WILDCARD.equals(values.get(0));
    }

    private static boolean containsColon(RequestParameters params, String name) {
        for (String v : params.getAll(name)) {
            if (v != null && v.contains(":")) {
                return true;
            }
        }
        return false;
    }
}
