package com.sqlrecorder.agent;

import java.time.Duration;

/**
 * Recorder settings.
 *
 * Parsed from comma-separated key=value pairs, e.g.
 *   max_requests=100,id_length=12,stack_depth=20,detail_ttl=600,format_sql=false
 *
 * Keys:
 *   max_requests   cap of the summary list (default: 200)
 *   id_length      length of generated trace ids (default: 10)
 *   stack_depth    frames captured per call, 0 keeps all (default: 30)
 *   detail_ttl     expiry of detail records in seconds, 0 never expires (default: 0)
 *   format_sql     pretty-print captured statements (default: true)
 *   depth          depth limit when sanitizing request data (default: 3)
 *   max_elements   collection elements kept when sanitizing request data (default: 50)
 */
public record RecorderConfig(
    int maxRequests,
    int idLength,
    int stackDepth,
    long detailTtlSeconds,
    boolean formatSql,
    int depthLimit,
    int maxCollectionElements
) {

    /** System property read by {@link #fromSystemProperty()}. */
    public static final String PROPERTY = "sqlrecorder.args";

    public static RecorderConfig defaults() {
        return parse(null);
    }

    public static RecorderConfig fromSystemProperty() {
        return parse(System.getProperty(PROPERTY));
    }

    public static RecorderConfig parse(String args) {
        int maxRequests = 200;
        int idLength = 10;
        int stackDepth = 30;
        long detailTtlSeconds = 0;
        boolean formatSql = true;
        int depthLimit = 3;
        int maxCollectionElements = 50;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) continue;
                String value = kv[1].trim();
                switch (kv[0].trim()) {
                    case "max_requests" -> maxRequests           = positiveOr(value, maxRequests);
                    case "id_length"    -> idLength              = positiveOr(value, idLength);
                    case "stack_depth"  -> stackDepth            = nonNegativeOr(value, stackDepth);
                    case "detail_ttl"   -> detailTtlSeconds      = nonNegativeOr(value, (int) detailTtlSeconds);
                    case "format_sql"   -> formatSql             = !"false".equalsIgnoreCase(value);
                    case "depth"        -> depthLimit            = positiveOr(value, depthLimit);
                    case "max_elements" -> maxCollectionElements = positiveOr(value, maxCollectionElements);
                    default -> { }
                }
            }
        }
        return new RecorderConfig(maxRequests, idLength, stackDepth, detailTtlSeconds,
            formatSql, depthLimit, maxCollectionElements);
    }

    public Duration detailTtl() {
        return Duration.ofSeconds(detailTtlSeconds);
    }

    private static int positiveOr(String value, int fallback) {
        int parsed = nonNegativeOr(value, fallback);
        return parsed > 0 ? parsed : fallback;
    }

    private static int nonNegativeOr(String value, int fallback) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed >= 0 ? parsed : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
