package in.epicast.domain.model;

import java.util.Objects;

/**
 * Identity of a signal: (source, signal).
 */
public record SignalKey(String source, String signal) {

    public SignalKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(signal, "signal");
    }

    public static SignalKey of(String source, String signal) {
        return new SignalKey(source, signal);
    }

    @Override
    public String toString() {
        return source + ":" + signal;
    }
}
