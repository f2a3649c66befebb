package com.sqlrecorder.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Process-wide query entry point that application code calls instead of the raw executor.
 *
 * The call interceptor is generated once by {@link #install()}; later installs are no-ops.
 * Each call is then routed per thread: threads with a Recorder attached go through the
 * interceptor, every other thread reaches the raw executor directly. Detaching a Recorder
 * therefore restores the unwrapped entry point for that thread only.
 */
public class QueryDispatch implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryDispatch.class);

    private final QueryExecutor executor;
    private final RecorderConfig config;
    private volatile QueryExecutor interceptor;

    public QueryDispatch(QueryExecutor executor, RecorderConfig config) {
        this.executor = executor;
        this.config = config;
    }

    /** Generates the call interceptor on first use. Safe to call from every request. */
    public void install() {
        if (interceptor != null) return;
        synchronized (this) {
            if (interceptor == null) {
                interceptor = CallInterceptor.wrap(executor, config);
                log.debug("call interceptor installed around {}", executor.getClass().getName());
            }
        }
    }

    public boolean isInstalled() {
        return interceptor != null;
    }

    /** The executor the current thread's queries are sent to. */
    public QueryExecutor target() {
        QueryExecutor wrapped = interceptor;
        return wrapped != null && RecorderContext.isAttached() ? wrapped : executor;
    }

    /** The raw executor, never intercepted. */
    public QueryExecutor unwrapped() {
        return executor;
    }

    @Override
    public List<Map<String, Object>> sql(String query, Object... params) throws SQLException {
        return target().sql(query, params);
    }

    @Override
    public String lastExecutedQuery() {
        return executor.lastExecutedQuery();
    }

    @Override
    public List<String> lastColumnNames() {
        return executor.lastColumnNames();
    }
}
