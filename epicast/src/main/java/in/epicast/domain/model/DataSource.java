package in.epicast.domain.model;

import java.util.List;

/**
 * A public data source. {@code source} is the public identifier; {@code dbSource}
 * the storage partition it is read from, which several public sources may share.
 */
public record DataSource(
    String source,
    String dbSource,
    String name,
    boolean active,
    String description,
    String referenceSignal,
    String license,
    String dua,
    List<WebLink> links,
    List<DataSignal> signals
) {
    public DataSource {
        if (dbSource == null || dbSource.isBlank()) {
            dbSource = source;
        }
        links = links == null ? List.of() : List.copyOf(links);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public boolean usesAlias() {
        return !source.equals(dbSource);
    }

    public boolean declares(String signal) {
        for (DataSignal s : signals) {
            if (s.signal().equals(signal)) {
                return true;
            }
        }
        return false;
    }

    public List<String> signalNames() {
        return signals.stream().map(DataSignal::signal).toList();
    }

    public DataSource withSignals(List<DataSignal> newSignals) {
        return new DataSource(source, dbSource, name, active, description, referenceSignal,
            license, dua, links, newSignals);
    }
}
