package com.github.linkyeeter.model;

import lombok.Data;

/**
 * Outcome of fitting a source into the upload limit.
 */
@Data
public class BitrateDecision {

    /**
     * Highest video bitrate that still fits the upload limit, or null when the duration is unknown.
     */
    private final Long maxBitrateKbps;

    /**
     * Bitrate to pass to the transcoder, or null to encode unconstrained.
     */
    private final Long targetBitrateKbps;

    private final boolean reduced;

    public static BitrateDecision unconstrained(Long maxBitrateKbps) {
        return new BitrateDecision(maxBitrateKbps, null, false);
    }

    public static BitrateDecision reducedTo(long targetBitrateKbps) {
        return new BitrateDecision(targetBitrateKbps, targetBitrateKbps, true);
    }
}
