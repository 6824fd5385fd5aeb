package com.metallisense.common.model;

/**
 * Common shape of every pipeline stage output, checked by
 * {@code DecisionPolicy.validateAgentResponse} before it is surfaced.
 */
public interface StageResponse {

    String agent();

    double confidence();

    String explanation();
}
