package com.github.linkyeeter.exception;

/**
 * Exception thrown when a downloaded source is larger than the cap it was fetched with.
 */
public class SizeLimitException extends PipelineException {

    private final long limitMb;
    private final long actualMb;

    public SizeLimitException(long limitMb, long actualMb) {
        super("base file size exceeded " + limitMb + " MB");
        this.limitMb = limitMb;
        this.actualMb = actualMb;
    }

    public long getLimitMb() {
        return limitMb;
    }

    public long getActualMb() {
        return actualMb;
    }
}
