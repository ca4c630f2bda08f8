package in.epicast.repository;

import java.util.Iterator;
import java.util.Map;

/**
 * Forward-only, single-pass sequence of raw rows addressed by column name.
 * Must be closed on every exit path; closing early releases the underlying
 * storage cursor.
 */
public interface RowCursor extends Iterator<Map<String, Object>>, AutoCloseable {

    @Override
    void close();
}
