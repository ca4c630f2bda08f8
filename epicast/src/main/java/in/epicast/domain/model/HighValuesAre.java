package in.epicast.domain.model;

import java.util.Locale;

public enum HighValuesAre {
    BAD,
    GOOD,
    NEUTRAL;

    public static HighValuesAre parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
