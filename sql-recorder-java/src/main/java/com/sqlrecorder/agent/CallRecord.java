package com.sqlrecorder.agent;

import com.google.gson.annotations.SerializedName;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One intercepted query. Serialized as an entry of the {@code calls} array of a detail record.
 */
public class CallRecord {

    /** Literal statement text as sent to the database, formatted for display. */
    @SerializedName("query")
    public String query;

    @SerializedName("stack")
    public String stack;

    /** Start of the call in seconds since the epoch. */
    @SerializedName("time")
    public double time;

    /** Duration of the call in milliseconds, 3 decimal places. */
    @SerializedName("duration")
    public double duration;

    public CallRecord() {}

    public CallRecord(String query, String stack, double time, double duration) {
        this.query = query;
        this.stack = stack;
        this.time = time;
        this.duration = roundMillis(duration);
    }

    /** Rounds a millisecond value half-up to 3 decimal places. */
    public static double roundMillis(double millis) {
        return BigDecimal.valueOf(millis).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
