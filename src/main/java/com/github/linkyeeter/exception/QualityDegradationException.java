package com.github.linkyeeter.exception;

/**
 * Exception thrown when fitting the upload limit would cut the bitrate below the accepted cutoff.
 * The requester may retry with fallback mode enabled.
 */
public class QualityDegradationException extends PipelineException {

    private final long maxBitrateKbps;
    private final long cutoffKbps;
    private final long originalBitrateKbps;

    public QualityDegradationException(long maxBitrateKbps, long cutoffKbps, long originalBitrateKbps) {
        super(String.format("quality degradation too severe: %d kbps allowed, %d kbps original (cutoff %d kbps)",
                maxBitrateKbps, originalBitrateKbps, cutoffKbps));
        this.maxBitrateKbps = maxBitrateKbps;
        this.cutoffKbps = cutoffKbps;
        this.originalBitrateKbps = originalBitrateKbps;
    }

    public long getMaxBitrateKbps() {
        return maxBitrateKbps;
    }

    public long getCutoffKbps() {
        return cutoffKbps;
    }

    public long getOriginalBitrateKbps() {
        return originalBitrateKbps;
    }
}
