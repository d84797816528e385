package com.github.linkyeeter.model;

import com.github.linkyeeter.util.TempWorkspace;
import lombok.Getter;
import lombok.NonNull;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Output of a processed task. Owns the workspace the video lives in;
 * the caller closes it once the video is no longer needed.
 */
public class TaskOutput implements Closeable {

    private final TempWorkspace workspace;

    @Getter
    private final Path videoFile;

    private final Path thumbnail;

    /**
     * Metadata of the original (downloaded) file.
     */
    @Getter
    private final ProbeMetadata metadata;

    private final Long reducedBitrateKbps;

    public TaskOutput(@NonNull TempWorkspace workspace, @NonNull Path videoFile, Path thumbnail,
                      @NonNull ProbeMetadata metadata, Long reducedBitrateKbps) {
        this.workspace = workspace;
        this.videoFile = videoFile;
        this.thumbnail = thumbnail;
        this.metadata = metadata;
        this.reducedBitrateKbps = reducedBitrateKbps;
    }

    public TempWorkspace getWorkspace() {
        return workspace;
    }

    public Optional<Path> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public Optional<Long> getReducedBitrateKbps() {
        return Optional.ofNullable(reducedBitrateKbps);
    }

    /**
     * Percentage by which the bitrate was lowered compared to the original, if it was.
     */
    public Optional<Double> getReductionPercentage() {
        if (reducedBitrateKbps == null || metadata.getBitrateKbps() == 0) {
            return Optional.empty();
        }
        double ratio = (double) reducedBitrateKbps / metadata.getBitrateKbps();
        return Optional.of((1.0 - ratio) * 100.0);
    }

    @Override
    public void close() {
        workspace.close();
    }

    @Override
    public String toString() {
        return "TaskOutput{videoFile=" + videoFile
                + ", thumbnail=" + (thumbnail != null ? "Some(_)" : "None")
                + ", metadata=" + metadata
                + ", reducedBitrateKbps=" + reducedBitrateKbps + "}";
    }
}
