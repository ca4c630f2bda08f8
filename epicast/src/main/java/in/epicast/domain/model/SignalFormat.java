package in.epicast.domain.model;

import java.util.Locale;

/**
 * Unit of a signal's values.
 */
public enum SignalFormat {
    PER100K,
    PERCENT,
    FRACTION,
    RAW_COUNT,
    RAW,
    COUNT;

    /**
     * Raw kinds hold values that can be differenced and smoothed to
     * reconstruct related signals. Normalized units cannot.
     */
    public boolean isRawKind() {
        return this == RAW || this == RAW_COUNT || this == COUNT;
    }

    public static SignalFormat parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
