package com.github.linkyeeter.service.media;

import com.github.linkyeeter.model.ProbeMetadata;

import java.nio.file.Path;
import java.util.Optional;

public interface VideoProber {

    /**
     * Read duration, bitrate and dimensions of a file.
     *
     * @return Metadata, or empty if the file has no decodable video stream or probing failed
     */
    Optional<ProbeMetadata> probe(Path file);
}
