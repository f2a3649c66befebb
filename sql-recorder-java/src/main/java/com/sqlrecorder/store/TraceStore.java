package com.sqlrecorder.store;

import java.time.Duration;
import java.util.List;

/**
 * Gateway over the shared key-value/list store that holds recorded traces.
 *
 * List indices follow the usual cache semantics: {@code start}/{@code end} are inclusive
 * and negative values count from the tail ({@code -1} is the last element).
 *
 * Implementations throw {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface TraceStore {

    void set(String key, String value);

    /** Stores {@code value} under {@code key}; a zero or negative {@code ttl} means no expiry. */
    void set(String key, String value, Duration ttl);

    /** Returns the value stored under {@code key}, or null if absent or expired. */
    String get(String key);

    /** Removes {@code key}, whether it holds a value or a list. */
    void delete(String key);

    /** Pushes {@code value} onto the head of the list at {@code key}. */
    void push(String key, String value);

    List<String> range(String key, int start, int end);

    /** Keeps only the elements between {@code start} and {@code end} of the list at {@code key}. */
    void trim(String key, int start, int end);
}
