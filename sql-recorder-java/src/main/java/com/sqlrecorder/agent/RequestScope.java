package com.sqlrecorder.agent;

/**
 * Scope of one request handler:
 *
 *   try (RequestScope scope = controller.begin(request)) {
 *       handler.handle(request);
 *   }
 *
 * Closing detaches the Recorder and dumps what was recorded, including for handlers that ended
 * with an exception. A request whose Recorder was detached by a control operation is not dumped.
 */
public class RequestScope implements AutoCloseable {

    private final ActivationController controller;
    private final Recorder recorder;
    private RequestTrace trace;
    private boolean closed;

    RequestScope(ActivationController controller, Recorder recorder) {
        this.controller = controller;
        this.recorder = recorder;
    }

    public boolean isRecording() {
        return recorder != null;
    }

    /** The Recorder of this request, or null if recording was inactive when it started. */
    public Recorder recorder() {
        return recorder;
    }

    /** The dumped record once the scope is closed; null for unrecorded requests. */
    public RequestTrace trace() {
        return trace;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (recorder == null) return;
        if (RecorderContext.current() == recorder) {
            trace = controller.dump();
        }
    }
}
