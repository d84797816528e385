package com.github.linkyeeter.exception;

/**
 * Base exception for all errors raised while processing a task.
 * The message is what the requester ends up seeing as the failure reason.
 */
public class PipelineException extends LinkYeeterException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public PipelineException(Throwable cause) {
        super(cause);
    }
}
