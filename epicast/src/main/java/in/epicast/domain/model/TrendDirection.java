package in.epicast.domain.model;

import java.util.Locale;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STEADY,
    UNKNOWN;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
