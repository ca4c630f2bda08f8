package in.epicast.infrastructure.persistence;

import in.epicast.domain.common.DatabaseErrorException;
import in.epicast.repository.RowCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for JDBC execution and cursor lifecycle.
 */
@ExtendWith(MockitoExtension.class)
class JdbcFactStoreTest {

    private static final String SQL = "SELECT t.source, t.value FROM covidcast t WHERE t.source = :source_0";

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection conn;
    @Mock
    private PreparedStatement ps;
    @Mock
    private ResultSet rs;
    @Mock
    private ResultSetMetaData metaData;

    private JdbcFactStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcFactStore(dataSource);
    }

    private void stubExecution() throws SQLException {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString(), anyInt(), anyInt())).thenReturn(ps);
        when(ps.executeQuery()).thenReturn(rs);
    }

    @Test
    void execute_streamsRowsAndClosesOnExhaustion() throws Exception {
        stubExecution();
        when(rs.next()).thenReturn(true, true, false);
        when(rs.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("SOURCE");
        when(metaData.getColumnLabel(2)).thenReturn("value");
        when(rs.getObject(1)).thenReturn("src", "src");
        when(rs.getObject(2)).thenReturn(1.5, 2.5);

        RowCursor cursor = store.execute(SQL, Map.of("source_0", "src"));

        verify(conn).prepareStatement("SELECT t.source, t.value FROM covidcast t WHERE t.source = ?",
            ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
        verify(ps).setObject(1, "src");
        verify(ps).setFetchSize(anyInt());

        assertTrue(cursor.hasNext());
        assertEquals(Map.of("source", "src", "value", 1.5), cursor.next());
        assertEquals(Map.of("source", "src", "value", 2.5), cursor.next());
        assertFalse(cursor.hasNext());

        verify(rs).close();
        verify(ps).close();
        verify(conn).close();
        verify(metaData, times(1)).getColumnCount();
    }

    @Test
    void execute_runsInsideReadTransactionSoRowsAreFetchedInBatches() throws Exception {
        stubExecution();
        when(rs.next()).thenReturn(false);

        RowCursor cursor = store.execute(SQL, Map.of("source_0", "src"));
        assertFalse(cursor.hasNext());

        InOrder order = inOrder(conn, ps);
        order.verify(conn).setAutoCommit(false);
        order.verify(conn).prepareStatement(anyString(), anyInt(), anyInt());
        order.verify(ps).setFetchSize(anyInt());
        order.verify(ps).executeQuery();
        order.verify(ps).close();
        order.verify(conn).rollback();
        order.verify(conn).setAutoCommit(true);
        order.verify(conn).close();
    }

    @Test
    void close_beforeExhaustionReleasesResources() throws Exception {
        stubExecution();

        RowCursor cursor = store.execute(SQL, Map.of("source_0", "src"));
        cursor.close();
        cursor.close();

        assertFalse(cursor.hasNext());
        verify(rs, times(1)).close();
        verify(ps, times(1)).close();
        verify(conn, times(1)).close();
        verify(rs, never()).next();
    }

    @Test
    void execute_failureIsWrappedAndResourcesClosed() throws Exception {
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.prepareStatement(anyString(), anyInt(), anyInt())).thenReturn(ps);
        when(ps.executeQuery()).thenThrow(new SQLException("relation does not exist"));

        DatabaseErrorException e = assertThrows(DatabaseErrorException.class,
            () -> store.execute(SQL, Map.of("source_0", "src")));

        assertEquals(SQL, e.getSql());
        assertInstanceOf(SQLException.class, e.getCause());
        verify(ps).close();
        verify(conn).rollback();
        verify(conn).setAutoCommit(true);
        verify(conn).close();
    }

    @Test
    void execute_connectionFailureIsWrapped() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("pool exhausted"));

        assertThrows(DatabaseErrorException.class, () -> store.execute(SQL, Map.of("source_0", "src")));
    }

    @Test
    void hasNext_readFailureClosesAndIsWrapped() throws Exception {
        stubExecution();
        when(rs.next()).thenThrow(new SQLException("connection reset"));

        RowCursor cursor = store.execute(SQL, Map.of("source_0", "src"));

        assertThrows(DatabaseErrorException.class, cursor::hasNext);
        verify(rs).close();
        verify(ps).close();
        verify(conn).close();
        assertFalse(cursor.hasNext());
    }

    @Test
    void close_continuesWhenOneResourceFailsToClose() throws Exception {
        stubExecution();
        doThrow(new SQLException("already closed")).when(rs).close();

        RowCursor cursor = store.execute(SQL, Map.of("source_0", "src"));
        cursor.close();

        verify(ps).close();
        verify(conn).close();
    }

    @Test
    void execute_missingParameterFailsBeforeConnecting() {
        assertThrows(IllegalArgumentException.class, () -> store.execute(SQL, Map.of()));

        verifyNoInteractions(dataSource);
    }
}
