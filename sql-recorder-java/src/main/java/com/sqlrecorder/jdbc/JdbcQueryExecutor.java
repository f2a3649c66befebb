package com.sqlrecorder.jdbc;

import com.sqlrecorder.agent.QueryExecutor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryExecutor} over a JDBC {@link DataSource}. Each call borrows a connection, runs a
 * prepared statement and returns its rows keyed by column label.
 *
 * The literal statement and the result columns are kept per thread, so one executor can serve
 * every request thread of the process.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private final DataSource dataSource;

    private final ThreadLocal<String> lastExecuted = new ThreadLocal<>();
    private final ThreadLocal<List<String>> lastColumns = ThreadLocal.withInitial(Collections::emptyList);

    public JdbcQueryExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Map<String, Object>> sql(String query, Object... params) throws SQLException {
        Object[] args = params == null ? new Object[0] : params;
        lastExecuted.set(StatementRenderer.render(query, args));
        lastColumns.set(Collections.emptyList());

        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(query)) {
            for (int i = 0; i < args.length; i++) {
                statement.setObject(i + 1, args[i]);
            }
            if (!statement.execute()) {
                return new ArrayList<>();
            }
            try (ResultSet rs = statement.getResultSet()) {
                return readRows(rs);
            }
        }
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<String> columns = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i));
        }
        lastColumns.set(Collections.unmodifiableList(columns));

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), rs.getObject(i + 1));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public String lastExecutedQuery() {
        return lastExecuted.get();
    }

    @Override
    public List<String> lastColumnNames() {
        return lastColumns.get();
    }
}
