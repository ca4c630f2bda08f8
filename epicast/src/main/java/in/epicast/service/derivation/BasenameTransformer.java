package in.epicast.service.derivation;

import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.model.DataSignal;
import in.epicast.domain.model.SignalKey;
import in.epicast.service.metadata.SignalRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites requested signals that are computed from a base signal into that
 * base signal, recording in a {@link ReplayTable} which derived signals each
 * base must be replayed as.
 *
 * Unregistered and non-derived signal names pass through unchanged. When a
 * request asks for a base signal together with signals derived from it, the
 * base is also registered as a replay target of itself, so its own rows are
 * still emitted.
 */
public final class BasenameTransformer {
    private static final Logger log = LoggerFactory.getLogger(BasenameTransformer.class);

    private final SignalRegistry registry;

    public BasenameTransformer(SignalRegistry registry) {
        this.registry = registry;
    }

    public DerivationPlan derivePlan(List<SourceSignalPair> pairs) {
        List<SourceSignalPair> expanded = registry.expandAll(pairs);

        Set<SignalKey> derivedBases = new HashSet<>();
        for (SourceSignalPair pair : expanded) {
            for (String name : pair.signals()) {
                derivedSignal(pair.source(), name)
                    .ifPresent(s -> derivedBases.add(new SignalKey(pair.source(), s.signalBasename())));
            }
        }

        ReplayTable.Builder table = ReplayTable.builder();
        List<SourceSignalPair> basePairs = new ArrayList<>(expanded.size());
        for (SourceSignalPair pair : expanded) {
            if (pair.allSignals()) {
                basePairs.add(pair);
                continue;
            }
            List<String> signals = new ArrayList<>(pair.signals().size());
            for (String name : pair.signals()) {
                SignalKey requested = new SignalKey(pair.source(), name);
                Optional<DataSignal> derived = derivedSignal(pair.source(), name);
                if (derived.isPresent()) {
                    String basename = derived.get().signalBasename();
                    signals.add(basename);
                    table.add(new SignalKey(pair.source(), basename), requested);
                } else {
                    signals.add(name);
                    if (derivedBases.contains(requested)) {
                        table.add(requested, requested);
                    }
                }
            }
            basePairs.add(SourceSignalPair.of(pair.source(), signals));
        }

        ReplayTable replayTable = table.build();
        if (!replayTable.isEmpty()) {
            log.debug("Derivation plan: {} -> {} with replay {}", pairs, basePairs, replayTable);
        }
        return new DerivationPlan(basePairs, replayTable);
    }

    private Optional<DataSignal> derivedSignal(String source, String name) {
        return registry.resolveSignal(new SignalKey(source, name))
            .filter(DataSignal::computeFromBase)
            .filter(s -> !s.isOwnBase());
    }
}
