package com.github.linkyeeter.service.media;

import java.nio.file.Path;
import java.util.Optional;

public interface ThumbnailExtractor {

    /**
     * Capture a single frame of a video. Best effort.
     *
     * @return Thumbnail file, or empty if none could be produced
     */
    Optional<Path> extract(Path videoFile);
}
