package com.github.linkyeeter.service.media;

import java.io.IOException;
import java.nio.file.Path;

public interface VideoTranscoder {

    /**
     * Produce a single playable file that fits the upload limit.
     *
     * @param input Source file
     * @param output File to create
     * @param bitrateKbps Target video bitrate, or null for no constraint
     * @throws com.github.linkyeeter.exception.ToolFailedException if the transcoder exits with a non-zero code
     * @throws IOException if the transcoder cannot be run
     */
    void transcode(Path input, Path output, Long bitrateKbps) throws IOException;
}
