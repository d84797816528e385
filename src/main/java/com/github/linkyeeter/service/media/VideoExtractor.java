package com.github.linkyeeter.service.media;

import java.io.IOException;
import java.nio.file.Path;

public interface VideoExtractor {

    /**
     * Download the video behind a URL into a directory as a single file.
     *
     * @param url Video page URL
     * @param outputDir Directory to write into
     * @param maxSizeMb Size cap in decimal megabytes
     * @throws com.github.linkyeeter.exception.ExtractionException if the cap was hit or the extractor failed
     * @throws IOException if the extractor cannot be run
     */
    void extract(String url, Path outputDir, long maxSizeMb) throws IOException;
}
