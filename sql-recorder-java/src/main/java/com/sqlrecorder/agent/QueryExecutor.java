package com.sqlrecorder.agent;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * The query entry point of the application's database layer.
 *
 * Besides executing statements, an executor exposes a side channel describing the last
 * statement it ran on the calling thread: the literal SQL text with bound values already
 * substituted, and the column names of its result.
 */
public interface QueryExecutor {

    /**
     * Executes {@code query} with positional {@code params}.
     *
     * @return result rows as ordered column → value maps; empty for statements without a result set
     */
    List<Map<String, Object>> sql(String query, Object... params) throws SQLException;

    /** Literal text of the last statement executed on this thread, or null if none. */
    String lastExecutedQuery();

    /** Result column names of the last statement executed on this thread. */
    List<String> lastColumnNames();
}
