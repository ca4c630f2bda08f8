package in.epicast.infrastructure.persistence;

import in.epicast.domain.common.DatabaseErrorException;
import in.epicast.repository.FactStore;
import in.epicast.repository.RowCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * JDBC implementation of FactStore.
 *
 * Rows are streamed from the ResultSet as the caller iterates. The PostgreSQL
 * driver only honours the fetch size inside a transaction, so each query runs
 * with autocommit off; the transaction is rolled back and the connection,
 * statement and result set are closed when the cursor is exhausted, closed
 * early, or fails.
 */
public final class JdbcFactStore implements FactStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcFactStore.class);

    private static final int FETCH_SIZE = 1000;

    private final DataSource dataSource;

    public JdbcFactStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public RowCursor execute(String sql, Map<String, Object> params) {
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        for (String name : parsed.parameterNames()) {
            if (!params.containsKey(name)) {
                throw new IllegalArgumentException("no value bound for query parameter :" + name);
            }
        }

        Connection conn = null;
        PreparedStatement ps = null;
        ResultSet rs = null;
        boolean inTransaction = false;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            inTransaction = true;
            ps = conn.prepareStatement(parsed.sql(), ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            ps.setFetchSize(FETCH_SIZE);
            List<String> names = parsed.parameterNames();
            for (int i = 0; i < names.size(); i++) {
                ps.setObject(i + 1, params.get(names.get(i)));
            }
            log.debug("Executing: {} with {}", parsed.sql(), params);
            rs = ps.executeQuery();
            return new ResultSetCursor(conn, ps, rs, sql);
        } catch (SQLException e) {
            closeAll(rs, ps);
            if (inTransaction) {
                endTransaction(conn);
            }
            closeAll(conn);
            log.error("Failed to execute query: {}", e.getMessage());
            throw new DatabaseErrorException("database error: " + e.getMessage(), sql, e);
        }
    }

    /**
     * Roll back the read-only transaction and restore autocommit before the
     * connection goes back to the pool.
     */
    static void endTransaction(Connection conn) {
        try {
            conn.rollback();
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to end read transaction: {}", e.getMessage());
        }
    }

    static void closeAll(AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    /**
     * Lazy cursor over an open ResultSet.
     */
    static final class ResultSetCursor implements RowCursor {
        private final Connection conn;
        private final PreparedStatement ps;
        private final ResultSet rs;
        private final String sql;
        private String[] columns;
        private Map<String, Object> pending;
        private boolean closed;
        private long rowCount;

        ResultSetCursor(Connection conn, PreparedStatement ps, ResultSet rs, String sql) {
            this.conn = conn;
            this.ps = ps;
            this.rs = rs;
            this.sql = sql;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (closed) {
                return false;
            }
            try {
                if (!rs.next()) {
                    close();
                    return false;
                }
                pending = readRow();
                return true;
            } catch (SQLException e) {
                close();
                log.error("Failed to read row {}: {}", rowCount, e.getMessage());
                throw new DatabaseErrorException("database error while reading rows: " + e.getMessage(), sql, e);
            }
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Map<String, Object> row = pending;
            pending = null;
            rowCount++;
            return row;
        }

        private Map<String, Object> readRow() throws SQLException {
            if (columns == null) {
                ResultSetMetaData md = rs.getMetaData();
                columns = new String[md.getColumnCount()];
                for (int i = 0; i < columns.length; i++) {
                    columns[i] = md.getColumnLabel(i + 1).toLowerCase(Locale.ROOT);
                }
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.length; i++) {
                row.put(columns[i], rs.getObject(i + 1));
            }
            return row;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            pending = null;
            closeAll(rs, ps);
            endTransaction(conn);
            closeAll(conn);
            log.debug("Cursor closed after {} rows", rowCount);
        }

        boolean isClosed() {
            return closed;
        }
    }
}
