package com.wellsfargo.compliance.engine.queue;

import com.wellsfargo.compliance.canonical.ComplianceResult;

/**
 * Receives the result of every job the validation queue completes.
 *
 * Called from worker threads, outside the queue lock. A listener that throws
 * is logged and skipped; it never affects the job or other listeners.
 */
public interface ComplianceResultListener {

    void onComplianceResult(String jobId, ComplianceResult result);
}
