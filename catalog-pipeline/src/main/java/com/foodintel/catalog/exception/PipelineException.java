package com.foodintel.catalog.exception;

/**
 * Unrecoverable failure of a pipeline run. The run is reported as FAILED and
 * nothing from it is persisted.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
