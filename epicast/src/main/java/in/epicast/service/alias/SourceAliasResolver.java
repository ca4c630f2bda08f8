package in.epicast.service.alias;

import in.epicast.domain.filter.SourceSignalPair;
import in.epicast.domain.model.DataSource;
import in.epicast.service.metadata.SignalRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites public source ids to the storage partition they are read from and
 * builds the mapping that restores the public id on every output row.
 */
public final class SourceAliasResolver {
    private static final Logger log = LoggerFactory.getLogger(SourceAliasResolver.class);

    private final SignalRegistry registry;

    public SourceAliasResolver(SignalRegistry registry) {
        this.registry = registry;
    }

    /**
     * Rewrite aliased sources to their storage id. A match-all pair of an
     * aliased source is expanded to that source's declared signals first, so
     * later stages never see a wildcard on a shared partition.
     *
     * @return rewritten pairs; the reverse mapper is present only if an alias was used
     */
    public AliasResolution resolve(List<SourceSignalPair> pairs) {
        Map<String, List<DataSource>> aliasToSources = new LinkedHashMap<>();
        List<SourceSignalPair> rewritten = new ArrayList<>(pairs.size());

        for (SourceSignalPair pair : pairs) {
            Optional<DataSource> source = registry.findSource(pair.source());
            if (source.isEmpty() || !source.get().usesAlias()) {
                rewritten.add(pair);
                continue;
            }
            DataSource ds = source.get();
            List<DataSource> aliases = aliasToSources.computeIfAbsent(ds.dbSource(), k -> new ArrayList<>());
            if (!aliases.contains(ds)) {
                aliases.add(ds);
            }
            if (pair.allSignals()) {
                rewritten.add(SourceSignalPair.of(ds.dbSource(), ds.signalNames()));
            } else {
                rewritten.add(pair.withSource(ds.dbSource()));
            }
        }

        if (aliasToSources.isEmpty()) {
            return new AliasResolution(pairs, Optional.empty());
        }

        List<DataSource> declared = registry.sources();
        for (List<DataSource> aliases : aliasToSources.values()) {
            aliases.sort(Comparator.comparingInt(declared::indexOf));
        }
        log.debug("Resolved source aliases: {}", aliasToSources.keySet());
        return new AliasResolution(rewritten, Optional.of(new ReverseMapper(aliasToSources)));
    }

    /**
     * storage id -> public sources aliasing it, in declaration order.
     */
    static final class ReverseMapper implements SourceAliasMapper {
        private final Map<String, List<DataSource>> aliasToSources;

        ReverseMapper(Map<String, List<DataSource>> aliasToSources) {
            Map<String, List<DataSource>> copy = new LinkedHashMap<>();
            aliasToSources.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            this.aliasToSources = Collections.unmodifiableMap(copy);
        }

        @Override
        public String toPublicSource(String storageSource, String signal) {
            List<DataSource> candidates = aliasToSources.get(storageSource);
            if (candidates == null || candidates.isEmpty()) {
                return storageSource;
            }
            if (candidates.size() == 1) {
                return candidates.get(0).source();
            }
            for (DataSource candidate : candidates) {
                if (candidate.declares(signal)) {
                    return candidate.source();
                }
            }
            return candidates.get(0).source();
        }
    }
}
