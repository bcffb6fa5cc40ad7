package com.foodintel.catalog.exception;

/**
 * Thrown when the running thread is interrupted between catalog pages or pipeline stages.
 * Cancellation is a clean stop, not a failure.
 */
public class PipelineCancelledException extends PipelineException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
