package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wellsfargo.compliance.canonical.enums.JobStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of a validation job.
 * 
 * Snapshots are taken under the queue lock, so a snapshot never shows a
 * terminal timestamp together with a non-terminal status.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueuedJob {
    String id;

    String scheme;

    CanonicalPaymentRecord record;

    JobStatus status;

    /**
     * Set only when status is COMPLETED.
     */
    ComplianceResult result;

    /**
     * Set only when status is FAILED.
     */
    String error;

    String queuedAt;

    String startedAt;

    String processedAt;

    /**
     * Batch the job was submitted with, if any.
     */
    String batchId;

    /**
     * 1-based queue position at submission time.
     */
    Integer position;
}
