package in.epicast.domain.model;

import java.util.Locale;

public enum SignalCategory {
    PUBLIC,
    EARLY,
    LATE,
    OTHER;

    public static SignalCategory parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
