package in.epicast.domain.filter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * "These signals from this source", or with {@code allSignals} every signal
 * registered under the source. Immutable; signal order is the request order
 * with duplicates removed.
 */
public record SourceSignalPair(String source, boolean allSignals, List<String> signals) {

    public SourceSignalPair {
        Objects.requireNonNull(source, "source");
        signals = allSignals ? List.of() : List.copyOf(new LinkedHashSet<>(signals));
    }

    public static SourceSignalPair of(String source, List<String> signals) {
        return new SourceSignalPair(source, false, signals);
    }

    public static SourceSignalPair of(String source, String... signals) {
        return new SourceSignalPair(source, false, List.of(signals));
    }

    public static SourceSignalPair all(String source) {
        return new SourceSignalPair(source, true, List.of());
    }

    public SourceSignalPair withSource(String newSource) {
        return new SourceSignalPair(newSource, allSignals, signals);
    }

    /**
     * Total number of concrete signals, used for request summaries.
     */
    public static int countSignals(List<SourceSignalPair> pairs) {
        List<String> all = new ArrayList<>();
        for (SourceSignalPair pair : pairs) {
            all.addAll(pair.signals());
        }
        return all.size();
    }

    @Override
    public String toString() {
        return source + ":" + (allSignals ? "*" : String.join(",", signals));
    }
}
