package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a queued validation job.
 * 
 * Transitions only move forward:
 * PENDING -> PROCESSING -> COMPLETED | FAILED
 */
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check whether moving from this status to {@code next} is a legal transition.
     */
    public boolean canTransitionTo(JobStatus next) {
        switch (this) {
            case PENDING:
                return next == PROCESSING;
            case PROCESSING:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
