package com.wellsfargo.compliance.error;

/**
 * Unexpected error while evaluating a record.
 * 
 * Unchecked: for queued jobs it is caught by the worker and recorded on the
 * job as FAILED, it never reaches the submitter.
 */
public class EvaluationFailureException extends RuntimeException {

    public EvaluationFailureException(String message) {
        super(message);
    }

    public EvaluationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
