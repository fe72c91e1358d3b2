package com.ivamare.pipeline.exception;

/**
 * Base exception for all pipeline errors.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
