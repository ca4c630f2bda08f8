package in.epicast.service.metadata;

import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.model.DataSignal;
import in.epicast.domain.model.DataSource;
import in.epicast.domain.model.SignalKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of data sources and signals, built once at startup by
 * {@link SignalGraphInitializer} and passed into every request-scoped component.
 * Safe for unsynchronized concurrent reads.
 */
public final class SignalRegistry {

    private final List<DataSource> sources;
    private final Map<String, DataSource> sourcesById;
    private final List<DataSignal> signals;
    private final Map<SignalKey, DataSignal> signalsByKey;
    private final List<String> warnings;

    SignalRegistry(List<DataSource> sources, List<DataSignal> signals, List<String> warnings) {
        this.sources = List.copyOf(sources);
        this.signals = List.copyOf(signals);
        this.warnings = List.copyOf(warnings);

        Map<String, DataSource> byId = new LinkedHashMap<>();
        for (DataSource source : sources) {
            byId.putIfAbsent(source.source(), source);
        }
        this.sourcesById = Collections.unmodifiableMap(byId);

        Map<SignalKey, DataSignal> byKey = new LinkedHashMap<>();
        for (DataSignal signal : signals) {
            byKey.putIfAbsent(signal.key(), signal);
        }
        this.signalsByKey = Collections.unmodifiableMap(byKey);
    }

    public static SignalRegistry empty() {
        return new SignalRegistry(List.of(), List.of(), List.of());
    }

    public List<DataSource> sources() {
        return sources;
    }

    public List<DataSignal> signals() {
        return signals;
    }

    /**
     * Data-quality defects found while the metadata graph was initialized.
     */
    public List<String> warnings() {
        return warnings;
    }

    public Optional<DataSource> findSource(String sourceId) {
        return Optional.ofNullable(sourcesById.get(sourceId));
    }

    public Optional<DataSignal> findSignal(SignalKey key) {
        return Optional.ofNullable(signalsByKey.get(key));
    }

    /**
     * Look up a signal by its public key, or, when {@code key.source()} is a
     * storage partition, by the first public source (declaration order) reading
     * from that partition that declares the signal.
     */
    public Optional<DataSignal> resolveSignal(SignalKey key) {
        DataSignal direct = signalsByKey.get(key);
        if (direct != null) {
            return Optional.of(direct);
        }
        for (DataSource source : sourcesForStorage(key.source())) {
            DataSignal aliased = signalsByKey.get(new SignalKey(source.source(), key.signal()));
            if (aliased != null) {
                return Optional.of(aliased);
            }
        }
        return Optional.empty();
    }

    /**
     * Public sources reading from the given storage partition through an alias,
     * in declaration order.
     */
    public List<DataSource> sourcesForStorage(String storageId) {
        List<DataSource> out = new ArrayList<>();
        for (DataSource source : sources) {
            if (source.usesAlias() && source.dbSource().equals(storageId)) {
                out.add(source);
            }
        }
        return out;
    }

    /**
     * All other signals of the same source sharing this signal's basename.
     */
    public List<DataSignal> getRelated(DataSignal signal) {
        List<DataSignal> related = new ArrayList<>();
        for (DataSignal other : signals) {
            if (!other.key().equals(signal.key())
                && other.source().equals(signal.source())
                && other.signalBasename().equals(signal.signalBasename())) {
                related.add(other);
            }
        }
        return related;
    }

    /**
     * Replace a match-all pair by the explicit list of signals its source
     * declares. Pairs of unknown sources, of sources without declared signals,
     * and explicit pairs are returned unchanged.
     */
    public SourceSignalPair expandAll(SourceSignalPair pair) {
        if (!pair.allSignals()) {
            return pair;
        }
        DataSource source = sourcesById.get(pair.source());
        if (source == null || source.signals().isEmpty()) {
            return pair;
        }
        return SourceSignalPair.of(source.source(), source.signalNames());
    }

    public List<SourceSignalPair> expandAll(List<SourceSignalPair> pairs) {
        List<SourceSignalPair> out = new ArrayList<>(pairs.size());
        for (SourceSignalPair pair : pairs) {
            out.add(expandAll(pair));
        }
        return out;
    }
}
