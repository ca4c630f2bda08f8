package in.epicast.service.derivation;

import in.epicast.domain.model.SignalKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the two-phase tag and replay iterator.
 */
class TagAndReplayIteratorTest {

    private record Row(String signal, int n) {}

    private static final SignalKey K = SignalKey.of("src", "k");
    private static final SignalKey T1 = SignalKey.of("src", "t1");
    private static final SignalKey T2 = SignalKey.of("src", "t2");

    private static List<TaggedRow<Row>> drain(List<Row> rows, ReplayTable table) {
        TagAndReplayIterator<Row> it = new TagAndReplayIterator<>(rows.iterator(), table,
            row -> SignalKey.of("src", row.signal()));
        List<TaggedRow<Row>> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    @Test
    void testNoMatchingKeysReturnsStreamUnchanged() {
        List<Row> rows = List.of(new Row("a", 1), new Row("b", 2), new Row("a", 3));
        ReplayTable table = ReplayTable.builder().add(K, T1).build();

        List<TaggedRow<Row>> out = drain(rows, table);

        assertEquals(3, out.size());
        for (int i = 0; i < rows.size(); i++) {
            assertSame(rows.get(i), out.get(i).row());
            assertEquals(SignalKey.of("src", rows.get(i).signal()), out.get(i).target());
            assertFalse(out.get(i).replayed());
        }
    }

    @Test
    void testKeyWithTwoTargetsIsReplayedAfterPassThroughRows() {
        List<Row> rows = List.of(
            new Row("k", 1), new Row("a", 2), new Row("k", 3), new Row("b", 4), new Row("k", 5));
        ReplayTable table = ReplayTable.builder().add(K, T1).add(K, T2).build();

        List<TaggedRow<Row>> out = drain(rows, table);

        List<Integer> order = new ArrayList<>();
        List<SignalKey> targets = new ArrayList<>();
        for (TaggedRow<Row> tagged : out) {
            order.add(tagged.row().n());
            targets.add(tagged.target());
        }
        assertEquals(List.of(2, 4, 1, 3, 5, 1, 3, 5), order);
        assertEquals(List.of(
            SignalKey.of("src", "a"), SignalKey.of("src", "b"), T1, T1, T1, T2, T2, T2), targets);

        // original count + (targets - 1) per buffered row
        assertEquals(rows.size() + 3 * (2 - 1), out.size());
    }

    @Test
    void testBufferedKeysReplayInFirstSeenOrder() {
        SignalKey other = SignalKey.of("src", "o");
        SignalKey otherTarget = SignalKey.of("src", "o_target");
        List<Row> rows = List.of(new Row("o", 1), new Row("k", 2), new Row("o", 3));
        ReplayTable table = ReplayTable.builder().add(K, T1).add(other, otherTarget).build();

        List<TaggedRow<Row>> out = drain(rows, table);

        assertEquals(List.of(otherTarget, otherTarget, T1), out.stream().map(TaggedRow::target).toList());
        assertEquals(List.of(1, 3, 2), out.stream().map(t -> t.row().n()).toList());
        assertTrue(out.stream().allMatch(TaggedRow::replayed));
    }

    @Test
    void testEmptyInputGivesEmptyOutput() {
        ReplayTable table = ReplayTable.builder().add(K, T1).add(K, T2).build();

        assertTrue(drain(List.of(), table).isEmpty());
        assertTrue(drain(List.of(), ReplayTable.empty()).isEmpty());
    }

    @Test
    void testBaseStreamIsReadOnceAndPhasesAreObservable() {
        List<Row> rows = List.of(new Row("a", 1), new Row("k", 2));
        int[] reads = {0};
        Iterator<Row> counting = new Iterator<>() {
            private final Iterator<Row> delegate = rows.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public Row next() {
                reads[0]++;
                return delegate.next();
            }
        };
        TagAndReplayIterator<Row> it = new TagAndReplayIterator<>(counting,
            ReplayTable.builder().add(K, T1).add(K, T2).build(), row -> SignalKey.of("src", row.signal()));

        assertFalse(it.inReplayPhase());
        assertEquals(1, it.next().row().n());
        assertFalse(it.inReplayPhase());
        assertEquals(T1, it.next().target());
        assertTrue(it.inReplayPhase());
        assertEquals(1, it.buffer().bufferedRows());
        assertEquals(2, it.buffer().replayCount());
        assertEquals(T2, it.next().target());
        assertFalse(it.hasNext());
        assertEquals(2, reads[0]);
    }

    @Test
    void testNextOnExhaustedIteratorThrows() {
        TagAndReplayIterator<Row> it = new TagAndReplayIterator<>(Collections.<Row>emptyIterator(),
            ReplayTable.empty(), row -> SignalKey.of("src", row.signal()));

        assertThrows(java.util.NoSuchElementException.class, it::next);
    }
}
