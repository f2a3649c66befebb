package com.sqlrecorder.store;

/** Key layout of the recorder in the shared store. */
public final class TraceKeys {

    private TraceKeys() {}

    /** Presence of this key means recording is active. */
    public static final String INTERCEPT_FLAG = "recorder-intercept";

    /** Bounded list of summary records, newest first. */
    public static final String REQUESTS = "recorder-requests";

    private static final String REQUEST_PREFIX = "recorder-request-";

    public static String request(String id) {
        return REQUEST_PREFIX + id;
    }
}
