package com.sqlrecorder.agent;

/**
 * Holds the Recorder of the request running on the current thread.
 *
 * A request is served by a single thread, so a ThreadLocal is enough to route intercepted calls
 * back to the right Recorder when requests run concurrently.
 */
public final class RecorderContext {

    private RecorderContext() {}

    private static final ThreadLocal<Recorder> current = new ThreadLocal<>();

    static void attach(Recorder recorder) {
        current.set(recorder);
    }

    /** Returns the Recorder attached to this thread, or null if the request is not being recorded. */
    public static Recorder current() {
        return current.get();
    }

    public static boolean isAttached() {
        return current.get() != null;
    }

    /** Removes and returns this thread's Recorder, or null if none was attached. */
    public static Recorder detach() {
        Recorder recorder = current.get();
        current.remove();
        return recorder;
    }

    static Recorder require() {
        Recorder recorder = current.get();
        if (recorder == null) {
            throw new IllegalStateException("No recorder attached to thread " + Thread.currentThread().getName());
        }
        return recorder;
    }
}
