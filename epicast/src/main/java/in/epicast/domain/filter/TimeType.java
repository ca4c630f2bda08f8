package in.epicast.domain.filter;

import java.util.Locale;

/**
 * Time granularity of a signal. Day values are encoded YYYYMMDD, week values
 * (MMWR epiweeks) YYYYWW.
 */
public enum TimeType {
    DAY("day"),
    WEEK("week");

    private final String code;

    TimeType(String code) {
        this.code = code;
    }

    /**
     * Value stored in the {@code time_type} column.
     */
    public String code() {
        return code;
    }

    /**
     * Parse a time type, or return null for an unknown / empty value.
     */
    public static TimeType fromCode(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (TimeType t : values()) {
            if (t.code.equals(v)) {
                return t;
            }
        }
        return null;
    }
}
