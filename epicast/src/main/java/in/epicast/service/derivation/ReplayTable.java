package in.epicast.service.derivation;

import in.epicast.domain.model.SignalKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multimap from a base signal key to the signal keys its rows must be replayed
 * as. Insertion order of keys and of targets defines output order.
 */
public final class ReplayTable {

    private static final ReplayTable EMPTY = new ReplayTable(Map.of());

    private final Map<SignalKey, List<SignalKey>> targets;

    private ReplayTable(Map<SignalKey, List<SignalKey>> targets) {
        Map<SignalKey, List<SignalKey>> copy = new LinkedHashMap<>();
        targets.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.targets = Collections.unmodifiableMap(copy);
    }

    public static ReplayTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Replay targets of a key, empty if rows of that key pass through untouched.
     */
    public List<SignalKey> targetsOf(SignalKey key) {
        return targets.getOrDefault(key, List.of());
    }

    public boolean replays(SignalKey key) {
        return targets.containsKey(key);
    }

    public Set<SignalKey> keys() {
        return targets.keySet();
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public int size() {
        return targets.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReplayTable other && targets.equals(other.targets);
    }

    @Override
    public int hashCode() {
        return targets.hashCode();
    }

    @Override
    public String toString() {
        return "ReplayTable" + targets;
    }

    public static final class Builder {
        private final Map<SignalKey, List<SignalKey>> targets = new LinkedHashMap<>();

        /**
         * Add a replay target; a target already registered under the key is ignored.
         */
        public Builder add(SignalKey baseKey, SignalKey target) {
            List<SignalKey> list = targets.computeIfAbsent(baseKey, k -> new ArrayList<>());
            if (!list.contains(target)) {
                list.add(target);
            }
            return this;
        }

        public ReplayTable build() {
            return targets.isEmpty() ? EMPTY : new ReplayTable(targets);
        }
    }
}
