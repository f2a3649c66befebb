package com.sqlrecorder.agent;

/**
 * Notified after a Recorder has written its trace, so that observers can refresh.
 */
@FunctionalInterface
public interface DumpListener {

    /** Event name published after every dump. */
    String DUMP_EVENT = "recorder-dump-event";

    DumpListener NONE = (event, summary) -> { };

    void onDump(String event, RequestTrace summary);
}
