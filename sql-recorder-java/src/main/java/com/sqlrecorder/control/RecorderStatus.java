package com.sqlrecorder.control;

/** Recording state as reported to the control UI. */
public record RecorderStatus(String status, String color) {

    public static final RecorderStatus ACTIVE = new RecorderStatus("Active", "green");
    public static final RecorderStatus INACTIVE = new RecorderStatus("Inactive", "red");

    public boolean isActive() {
        return this.equals(ACTIVE);
    }
}
