package com.metallisense.common.model;

/**
 * How abnormal a spectrometer reading is. {@link #ERROR} marks a reading that
 * could not be scored.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    ERROR
}
