package com.sqlrecorder.agent;

import java.util.Map;

/**
 * The inbound request as seen by the recorder. Supplied by the web layer.
 */
public interface RequestContext {

    String path();

    String method();

    /** Name of the server command the request invokes, or null if it names none. */
    String command();

    Map<String, String> headers();

    Map<String, ?> formData();

    static RequestContext of(String path, String method, String command,
                             Map<String, String> headers, Map<String, ?> formData) {
        return new Basic(path, method, command, headers, formData);
    }

    record Basic(
        String path,
        String method,
        String command,
        Map<String, String> headers,
        Map<String, ?> formData
    ) implements RequestContext {}
}
