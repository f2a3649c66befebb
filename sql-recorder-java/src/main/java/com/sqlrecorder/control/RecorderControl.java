package com.sqlrecorder.control;

import com.sqlrecorder.agent.ActivationController;
import com.sqlrecorder.agent.Recorder;
import com.sqlrecorder.agent.RecorderContext;
import com.sqlrecorder.agent.RequestTrace;
import com.sqlrecorder.agent.TraceSerializer;
import com.sqlrecorder.store.TraceKeys;
import com.sqlrecorder.store.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operations behind the recorder's control UI.
 *
 * None of them is ever recorded: each one first detaches the calling thread's Recorder, which
 * also sends the thread's queries back to the unwrapped executor.
 */
public class RecorderControl {

    private static final Logger log = LoggerFactory.getLogger(RecorderControl.class);

    private final ActivationController controller;
    private final TraceStore store;

    public RecorderControl(ActivationController controller) {
        this.controller = controller;
        this.store = controller.store();
    }

    public RecorderStatus getStatus() {
        return doNotRecord(() -> controller.isActive() ? RecorderStatus.ACTIVE : RecorderStatus.INACTIVE);
    }

    /** Enables recording when {@code shouldRecord} is "true", disables it for any other value. */
    public RecorderStatus setState(String shouldRecord) {
        return doNotRecord(() -> {
            if ("true".equals(shouldRecord)) {
                controller.activate();
                return RecorderStatus.ACTIVE;
            }
            controller.deactivate();
            return RecorderStatus.INACTIVE;
        });
    }

    /** Summaries of the recorded requests, newest first. */
    public List<RequestTrace> get() {
        return doNotRecord(() -> {
            List<RequestTrace> result = new ArrayList<>();
            for (String json : store.range(TraceKeys.REQUESTS, 0, -1)) {
                result.add(TraceSerializer.fromJson(json));
            }
            return result;
        });
    }

    /**
     * Full record of one request.
     *
     * @throws TraceNotFoundException if {@code id} is unknown or expired
     * @throws IllegalArgumentException if {@code id} is blank
     */
    public RequestTrace get(String id) {
        return doNotRecord(() -> {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("A trace id is required; use get() to list requests");
            }
            String json = store.get(TraceKeys.request(id));
            if (json == null) {
                throw new TraceNotFoundException(id);
            }
            return TraceSerializer.fromJson(json);
        });
    }

    /** Clears the request list. Detail records stay until they expire. */
    public void delete() {
        doNotRecord(() -> {
            store.delete(TraceKeys.REQUESTS);
            log.info("recorded request list cleared");
            return null;
        });
    }

    /**
     * Runs {@code action} on this thread without recording it. The thread's Recorder, if any, is
     * detached first and is not restored afterwards.
     */
    public static <T> T doNotRecord(Supplier<T> action) {
        Recorder detached = RecorderContext.detach();
        if (detached != null) {
            log.debug("dropped recorder {} for control call", detached.id());
        }
        return action.get();
    }
}
