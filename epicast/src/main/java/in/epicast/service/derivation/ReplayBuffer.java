package in.epicast.service.derivation;

import in.epicast.domain.model.SignalKey;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Holds the rows whose key has replay targets until the base stream is
 * exhausted, then replays them once per target.
 *
 * Replay order: keys in the order they were first offered; per key, targets in
 * replay table order; per target, rows in the order they were offered.
 */
public final class ReplayBuffer<R> {

    private final ReplayTable table;
    private final Map<SignalKey, List<R>> buffered = new LinkedHashMap<>();
    private int rowCount;

    public ReplayBuffer(ReplayTable table) {
        this.table = table;
    }

    /**
     * Buffer the row if its key is replayed.
     *
     * @return false if the row must pass straight through
     */
    public boolean offer(R row, SignalKey key) {
        if (!table.replays(key)) {
            return false;
        }
        buffered.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        rowCount++;
        return true;
    }

    public int bufferedRows() {
        return rowCount;
    }

    /**
     * Number of rows {@link #replay()} will produce.
     */
    public int replayCount() {
        int total = 0;
        for (Map.Entry<SignalKey, List<R>> e : buffered.entrySet()) {
            total += e.getValue().size() * table.targetsOf(e.getKey()).size();
        }
        return total;
    }

    public Iterator<TaggedRow<R>> replay() {
        return new ReplayIterator();
    }

    private final class ReplayIterator implements Iterator<TaggedRow<R>> {
        private final Iterator<Map.Entry<SignalKey, List<R>>> keys = buffered.entrySet().iterator();
        private List<R> rows = List.of();
        private List<SignalKey> targets = List.of();
        private int targetIndex;
        private int rowIndex;

        @Override
        public boolean hasNext() {
            while (targetIndex >= targets.size() || rowIndex >= rows.size()) {
                if (targetIndex < targets.size()) {
                    targetIndex++;
                    rowIndex = 0;
                    continue;
                }
                if (!keys.hasNext()) {
                    return false;
                }
                Map.Entry<SignalKey, List<R>> next = keys.next();
                rows = next.getValue();
                targets = table.targetsOf(next.getKey());
                targetIndex = 0;
                rowIndex = 0;
            }
            return true;
        }

        @Override
        public TaggedRow<R> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return new TaggedRow<>(rows.get(rowIndex++), targets.get(targetIndex), true);
        }
    }
}
