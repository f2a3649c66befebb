package com.sqlrecorder.control;

/** Thrown when a trace id is unknown or its record has expired. */
public class TraceNotFoundException extends RuntimeException {

    private final String traceId;

    public TraceNotFoundException(String traceId) {
        super("No recorded request with id " + traceId);
        this.traceId = traceId;
    }

    public String getTraceId() {
        return traceId;
    }
}
