package com.metallisense.common.model;

/** Whether the correction stage ran for a request, and how it ended. */
public enum CorrectionStatus {
    INVOKED,
    SKIPPED,
    ERROR
}
