package com.wellsfargo.compliance.engine.queue;

import lombok.Value;

import java.util.List;

/**
 * Identifiers handed back for a batch submission, job ids in record order.
 */
@Value
public class BatchSubmission {
    String batchId;
    List<String> jobIds;
}
