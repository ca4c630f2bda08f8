package in.epicast.service.derivation;

import in.epicast.domain.model.SignalKey;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Two-phase iterator over base rows.
 *
 * Phase 1 reads the base stream exactly once: rows whose key has no replay
 * targets are emitted immediately, tagged with their own key; the others go to
 * a {@link ReplayBuffer}. Phase 2 starts when the base stream is exhausted and
 * emits the buffered rows once per replay target.
 */
public final class TagAndReplayIterator<R> implements Iterator<TaggedRow<R>> {

    private final Iterator<R> base;
    private final Function<R, SignalKey> keyFunction;
    private final ReplayBuffer<R> buffer;

    private TaggedRow<R> pending;
    private Iterator<TaggedRow<R>> replay;

    public TagAndReplayIterator(Iterator<R> base, ReplayTable table, Function<R, SignalKey> keyFunction) {
        this.base = base;
        this.keyFunction = keyFunction;
        this.buffer = new ReplayBuffer<>(table);
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (replay == null) {
            while (base.hasNext()) {
                R row = base.next();
                SignalKey key = keyFunction.apply(row);
                if (!buffer.offer(row, key)) {
                    pending = new TaggedRow<>(row, key, false);
                    return true;
                }
            }
            replay = buffer.replay();
        }
        if (replay.hasNext()) {
            pending = replay.next();
            return true;
        }
        return false;
    }

    @Override
    public TaggedRow<R> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        TaggedRow<R> out = pending;
        pending = null;
        return out;
    }

    /**
     * True once the base stream has been fully consumed.
     */
    public boolean inReplayPhase() {
        return replay != null;
    }

    public ReplayBuffer<R> buffer() {
        return buffer;
    }
}
