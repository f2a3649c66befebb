package com.sqlrecorder.agent;

import com.sqlrecorder.store.TraceKeys;
import com.sqlrecorder.store.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides at request start whether the request is recorded.
 *
 * The on/off state is the presence of {@link TraceKeys#INTERCEPT_FLAG} in the shared store, so
 * every worker sharing the store switches together without a restart. The flag is read once per
 * request: requests already in flight keep their Recorder when it changes.
 */
public class ActivationController {

    private static final Logger log = LoggerFactory.getLogger(ActivationController.class);

    private final TraceStore store;
    private final QueryDispatch dispatch;
    private final RecorderConfig config;
    private final DumpListener listener;

    public ActivationController(TraceStore store, QueryDispatch dispatch, RecorderConfig config) {
        this(store, dispatch, config, DumpListener.NONE);
    }

    public ActivationController(TraceStore store, QueryDispatch dispatch, RecorderConfig config,
                                DumpListener listener) {
        this.store = store;
        this.dispatch = dispatch;
        this.config = config;
        this.listener = listener;
    }

    public boolean isActive() {
        return store.get(TraceKeys.INTERCEPT_FLAG) != null;
    }

    public void activate() {
        store.set(TraceKeys.INTERCEPT_FLAG, "1");
        log.info("recording activated");
    }

    public void deactivate() {
        store.delete(TraceKeys.INTERCEPT_FLAG);
        log.info("recording deactivated");
    }

    /**
     * Request start hook. Attaches a new Recorder to the current thread if recording is active.
     *
     * @return the attached Recorder, or null if recording is inactive
     */
    public Recorder record(RequestContext request) {
        if (!isActive()) return null;
        Recorder recorder = new Recorder(request, config, dispatch, store, listener);
        if (RecorderContext.detach() != null) {
            log.debug("replacing recorder left on thread {}", Thread.currentThread().getName());
        }
        RecorderContext.attach(recorder);
        log.debug("recording request {} {} as {}", request.method(), request.path(), recorder.id());
        return recorder;
    }

    /**
     * Request end hook. Detaches this thread's Recorder and dumps it.
     *
     * @return the dumped record, or null if the request was not recorded
     */
    public RequestTrace dump() {
        Recorder recorder = RecorderContext.detach();
        if (recorder == null) return null;
        return recorder.dump();
    }

    /** Opens a scope that records the request and dumps it when closed. */
    public RequestScope begin(RequestContext request) {
        return new RequestScope(this, record(request));
    }

    public TraceStore store() {
        return store;
    }
}
