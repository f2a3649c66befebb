package com.sqlrecorder.agent;

import com.sqlrecorder.store.TraceKeys;
import com.sqlrecorder.store.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the calls intercepted during one request and writes them to the trace store.
 *
 * Created at request start by {@link ActivationController}; owned by the request's thread and
 * dropped when the request ends.
 */
public class Recorder {

    private static final Logger log = LoggerFactory.getLogger(Recorder.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String id;
    private final long createdAtMillis;
    private final String path;
    private final String method;
    private final String command;
    private final Map<String, String> headers;
    private final Map<String, Object> formData;
    private final List<CallRecord> calls = new ArrayList<>();

    private final RecorderConfig config;
    private final TraceStore store;
    private final DumpListener listener;

    /**
     * Captures the request's identity and data and makes sure the call interceptor is installed
     * on {@code dispatch}.
     */
    public Recorder(RequestContext request, RecorderConfig config, QueryDispatch dispatch,
                    TraceStore store, DumpListener listener) {
        this.id = newId(config.idLength());
        this.createdAtMillis = System.currentTimeMillis();
        this.path = nullToEmpty(request.path());
        this.method = nullToEmpty(request.method());
        this.command = nullToEmpty(request.command());
        this.headers = request.headers() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(request.headers());
        this.formData = ValueSanitizer.sanitizeMap(request.formData(), config);
        this.config = config;
        this.store = store;
        this.listener = listener;

        dispatch.install();
    }

    public void register(CallRecord call) {
        calls.add(call);
    }

    public String id() {
        return id;
    }

    public List<CallRecord> calls() {
        return Collections.unmodifiableList(calls);
    }

    /**
     * Writes this request to the store: the summary is pushed onto the bounded request list and
     * the full record is stored under its own key. Aggregates are computed fresh on every call;
     * dumping twice stores a second summary entry.
     *
     * @return the full record that was written
     */
    public RequestTrace dump() {
        RequestTrace trace = buildTrace(System.currentTimeMillis());
        RequestTrace summary = trace.summary();

        store.push(TraceKeys.REQUESTS, TraceSerializer.toJson(summary));
        store.trim(TraceKeys.REQUESTS, 0, config.maxRequests() - 1);
        store.set(TraceKeys.request(id), TraceSerializer.toJson(trace), config.detailTtl());

        log.debug("dumped request {} {} {}: {} queries in {} ms", id, method, path,
            trace.callCount, trace.totalQueryTimeMs);
        listener.onDump(DumpListener.DUMP_EVENT, summary);
        return trace;
    }

    RequestTrace buildTrace(long nowMillis) {
        RequestTrace trace = new RequestTrace();
        trace.id = id;
        trace.path = path;
        trace.command = command;
        trace.method = method;
        trace.createdAt = Instant.ofEpochMilli(createdAtMillis).toString();
        trace.callCount = calls.size();
        trace.totalQueryTimeMs = CallRecord.roundMillis(
            calls.stream().mapToDouble(c -> c.duration).sum());
        trace.totalDurationMs = CallRecord.roundMillis(Math.max(0, nowMillis - createdAtMillis));
        trace.calls = new ArrayList<>(calls);
        trace.http = new RequestTrace.Http();
        trace.http.headers = headers;
        trace.http.data = formData;
        return trace;
    }

    /** Random lowercase hex identifier of {@code length} characters. */
    static String newId(int length) {
        StringBuilder sb = new StringBuilder(length);
        byte[] bytes = new byte[(length + 1) / 2];
        RANDOM.nextBytes(bytes);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        sb.setLength(length);
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
