package com.github.linkyeeter.model;

import lombok.Builder;
import lombok.Data;

/**
 * Basic stream information of a video file. All fields are zero when unknown.
 */
@Data
@Builder
public class ProbeMetadata {

    private final long durationSeconds;
    private final long bitrateKbps;
    private final int width;
    private final int height;

    public static ProbeMetadata unknown() {
        return ProbeMetadata.builder().build();
    }

    public boolean hasDuration() {
        return durationSeconds > 0;
    }
}
