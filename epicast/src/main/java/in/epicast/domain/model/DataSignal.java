package in.epicast.domain.model;

import in.epicast.domain.filter.TimeType;

import java.util.List;

/**
 * Metadata of one signal. Keyed by (source, signal).
 *
 * {@code signalBasename} names the stored signal under the same source that
 * this one is computed from; a signal whose basename equals its own name is
 * its own base. Enum fields and text fields may be null / empty before the
 * metadata graph has applied its defaults.
 */
public record DataSignal(
    String source,
    String signal,
    String signalBasename,
    String name,
    String shortDescription,
    String description,
    String timeLabel,
    String valueLabel,
    SignalFormat format,
    SignalCategory category,
    HighValuesAre highValuesAre,
    boolean isSmoothed,
    boolean isWeighted,
    boolean isCumulative,
    boolean hasStderr,
    boolean hasSampleSize,
    boolean computeFromBase,
    TimeType timeType,
    List<WebLink> links
) {
    public DataSignal {
        if (signalBasename == null || signalBasename.isBlank()) {
            signalBasename = signal;
        }
        links = links == null ? List.of() : List.copyOf(links);
    }

    public SignalKey key() {
        return new SignalKey(source, signal);
    }

    public SignalKey baseKey() {
        return new SignalKey(source, signalBasename);
    }

    public boolean isOwnBase() {
        return signal.equals(signalBasename);
    }

    /**
     * Copy with resolved descriptive fields; the flags and identity stay as they are.
     */
    public DataSignal withDescriptives(String name, String shortDescription, String description,
                                       String valueLabel, SignalFormat format, SignalCategory category,
                                       HighValuesAre highValuesAre, TimeType timeType, List<WebLink> links) {
        return new DataSignal(source, signal, signalBasename, name, shortDescription, description,
            timeLabel, valueLabel, format, category, highValuesAre, isSmoothed, isWeighted, isCumulative,
            hasStderr, hasSampleSize, computeFromBase, timeType, links);
    }
}
