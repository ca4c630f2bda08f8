package in.epicast.service;

import in.epicast.domain.common.DatabaseErrorException;
import in.epicast.domain.data.FactRow;
import in.epicast.repository.RowCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily produced, single-pass stream of response rows.
 *
 * The underlying storage cursor is closed when the stream is exhausted, when
 * the caller closes it early, or when producing a row fails.
 */
public final class RowStream implements Iterator<FactRow>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RowStream.class);

    private final Iterator<FactRow> rows;
    private final RowCursor cursor;
    private final Runnable onClose;
    private boolean closed;

    RowStream(Iterator<FactRow> rows, RowCursor cursor, Runnable onClose) {
        this.rows = rows;
        this.cursor = cursor;
        this.onClose = onClose;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        boolean more;
        try {
            more = rows.hasNext();
        } catch (DatabaseErrorException e) {
            close();
            throw e;
        } catch (RuntimeException e) {
            close();
            log.error("Failed to produce row: {}", e.getMessage());
            throw new DatabaseErrorException("failed to read rows: " + e.getMessage(), e);
        }
        if (!more) {
            close();
        }
        return more;
    }

    @Override
    public FactRow next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return rows.next();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            cursor.close();
        } finally {
            onClose.run();
        }
    }
}
