package com.sqlrecorder.agent;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Converts {@link RequestTrace} records to and from the JSON blobs kept in the trace store.
 */
public final class TraceSerializer {

    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private TraceSerializer() {}

    public static String toJson(RequestTrace trace) {
        try {
            return GSON.toJson(trace);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new TraceSerializationException("Failed to serialize trace " + trace.id + ": " + e.getMessage(), e);
        }
    }

    public static RequestTrace fromJson(String json) {
        try {
            RequestTrace trace = GSON.fromJson(json, RequestTrace.class);
            if (trace == null) {
                throw new TraceSerializationException("Trace record is empty");
            }
            return trace;
        } catch (JsonParseException e) {
            throw new TraceSerializationException("Malformed trace record: " + e.getMessage(), e);
        }
    }

    public static class TraceSerializationException extends RuntimeException {
        public TraceSerializationException(String message) { super(message); }
        public TraceSerializationException(String message, Throwable cause) { super(message, cause); }
    }
}
