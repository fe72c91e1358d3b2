package com.ivamare.pipeline.exception;

/**
 * Thrown when an operator action does not apply to the current state.
 */
public class InvalidOperationException extends PipelineException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
