package com.github.linkyeeter.exception;

/**
 * Raised when a task result could not be delivered because the requester stopped waiting.
 * Only ever logged.
 */
public class ChannelClosedException extends PipelineException {

    private final String url;

    public ChannelClosedException(String url) {
        super("failed to send task result: channel closed");
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
