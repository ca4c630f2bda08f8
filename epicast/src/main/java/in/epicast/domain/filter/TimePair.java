package in.epicast.domain.filter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Time filter: a time type with points/ranges, or every time value of that type.
 */
public record TimePair(TimeType timeType, boolean allValues, List<TimeValue> timeValues) {

    public TimePair {
        Objects.requireNonNull(timeType, "timeType");
        timeValues = allValues ? List.of() : List.copyOf(timeValues);
    }

    public static TimePair of(TimeType timeType, List<TimeValue> timeValues) {
        return new TimePair(timeType, false, timeValues);
    }

    public static TimePair all(TimeType timeType) {
        return new TimePair(timeType, true, List.of());
    }

    /**
     * Whether a row of the given time type and value falls inside this filter.
     */
    public boolean matches(TimeType type, int value) {
        if (type != timeType) {
            return false;
        }
        if (allValues) {
            return true;
        }
        for (TimeValue tv : timeValues) {
            if (tv.contains(value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return timeType.code() + ":" + (allValues ? "*"
            : timeValues.stream().map(TimeValue::toString).collect(Collectors.joining(",")));
    }
}
