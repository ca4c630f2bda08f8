package in.epicast.service;

import in.epicast.domain.data.FactRow;
import in.epicast.domain.model.SignalKey;
import in.epicast.domain.model.TransformKind;
import in.epicast.service.alias.SourceAliasMapper;
import in.epicast.service.derivation.SeriesTransformer;
import in.epicast.service.derivation.TaggedRow;
import in.epicast.service.derivation.TransformSelector;
import in.epicast.service.query.ResponseProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Turns tagged base rows into response rows.
 *
 * Rows outside the requested time filter (read only as transform input) are
 * dropped. Pass-through rows only get their public source restored. Replayed rows
 * arrive as one contiguous block per target; each block is run through the
 * target's series transform, relabelled with the target signal and mapped
 * back to the public source.
 */
final class DerivedRowIterator implements Iterator<FactRow> {
    private static final Logger log = LoggerFactory.getLogger(DerivedRowIterator.class);

    private final Iterator<TaggedRow<FactRow>> tagged;
    private final TransformSelector selector;
    private final SeriesTransformer transformer;
    private final SourceAliasMapper aliasMapper;
    private final ResponseProjection projection;
    private final Predicate<FactRow> requested;

    private final Deque<FactRow> ready = new ArrayDeque<>();
    private TaggedRow<FactRow> lookahead;
    private long passThroughCount;
    private long replayedCount;

    DerivedRowIterator(Iterator<TaggedRow<FactRow>> tagged, TransformSelector selector,
                       SeriesTransformer transformer, SourceAliasMapper aliasMapper,
                       ResponseProjection projection, Predicate<FactRow> requested) {
        this.tagged = tagged;
        this.selector = selector;
        this.transformer = transformer;
        this.aliasMapper = aliasMapper;
        this.projection = projection;
        this.requested = requested;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && (lookahead != null || tagged.hasNext())) {
            TaggedRow<FactRow> first = lookahead != null ? lookahead : tagged.next();
            lookahead = null;
            if (!first.replayed()) {
                if (requested.test(first.row())) {
                    ready.add(finish(first.row(), first.target()));
                    passThroughCount++;
                }
            } else {
                replayBlock(first);
            }
        }
        return !ready.isEmpty();
    }

    @Override
    public FactRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    long passThroughCount() {
        return passThroughCount;
    }

    long replayedCount() {
        return replayedCount;
    }

    private void replayBlock(TaggedRow<FactRow> first) {
        SignalKey target = first.target();
        List<FactRow> block = new ArrayList<>();
        block.add(first.row());
        while (tagged.hasNext()) {
            TaggedRow<FactRow> next = tagged.next();
            if (next.replayed() && next.target().equals(target)) {
                block.add(next.row());
            } else {
                lookahead = next;
                break;
            }
        }

        SignalKey baseKey = SignalKey.of(first.row().source(), first.row().signal());
        TransformKind kind = target.equals(baseKey) ? TransformKind.IDENTITY : selector.select(target);
        List<FactRow> derived = transformer.apply(kind, block);
        log.debug("Replayed {} rows of {} as {} ({}): {} rows", block.size(), baseKey, target, kind, derived.size());

        for (FactRow row : derived) {
            if (requested.test(row)) {
                ready.add(finish(row, target));
                replayedCount++;
            }
        }
    }

    private FactRow finish(FactRow row, SignalKey target) {
        String publicSource = aliasMapper.toPublicSource(target.source(), target.signal());
        FactRow out = row.with(FactRow.SIGNAL, target.signal()).with(FactRow.SOURCE, publicSource);
        return projection.project(out);
    }
}
