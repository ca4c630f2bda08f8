package in.epicast.repository;

import java.util.Map;

/**
 * Read access to the append-only, issue-versioned fact table.
 */
public interface FactStore {

    /**
     * Execute a query with named parameters ({@code :name}).
     *
     * @throws in.epicast.domain.common.DatabaseErrorException if the backend fails
     */
    RowCursor execute(String sql, Map<String, Object> params);
}
