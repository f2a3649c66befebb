package com.sqlrecorder.agent;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * A recorded request as written to the trace store.
 *
 * The summary pushed onto the request list and the detail record stored per id share this
 * shape; a summary leaves {@code calls} and {@code http} null, which Gson omits.
 *
 * JSON schema:
 * {
 *   "id": "3f9a1c0b7e",
 *   "path": "/api/orders",
 *   "command": "orders.create",
 *   "method": "POST",
 *   "created_at": "2024-01-01T10:00:00Z",
 *   "call_count": 2,
 *   "total_query_time_ms": 15.0,
 *   "total_duration_ms": 42.118,
 *   "calls": [ {"query": "...", "stack": "...", "time": 1704103200.12, "duration": 5.0} ],
 *   "http": {"headers": {...}, "data": {...}}
 * }
 */
public class RequestTrace {

    @SerializedName("id")
    public String id;

    @SerializedName("path")
    public String path;

    @SerializedName("command")
    public String command;

    @SerializedName("method")
    public String method;

    @SerializedName("created_at")
    public String createdAt;

    @SerializedName("call_count")
    public int callCount;

    @SerializedName("total_query_time_ms")
    public double totalQueryTimeMs;

    @SerializedName("total_duration_ms")
    public double totalDurationMs;

    @SerializedName("calls")
    public List<CallRecord> calls;

    @SerializedName("http")
    public Http http;

    public static class Http {
        @SerializedName("headers") public Map<String, String> headers;
        @SerializedName("data")    public Map<String, Object> data;
    }

    /** Copy of this record without call detail and HTTP data. */
    public RequestTrace summary() {
        RequestTrace s = new RequestTrace();
        s.id = id;
        s.path = path;
        s.command = command;
        s.method = method;
        s.createdAt = createdAt;
        s.callCount = callCount;
        s.totalQueryTimeMs = totalQueryTimeMs;
        s.totalDurationMs = totalDurationMs;
        return s;
    }
}
