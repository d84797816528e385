package com.github.linkyeeter.service;

import com.github.linkyeeter.config.LinkYeeterProperties;
import com.github.linkyeeter.exception.ExtractionException;
import com.github.linkyeeter.exception.SizeLimitException;
import com.github.linkyeeter.exception.ToolFailedException;
import com.github.linkyeeter.exception.TranscodeException;
import com.github.linkyeeter.model.BitrateDecision;
import com.github.linkyeeter.model.ProbeMetadata;
import com.github.linkyeeter.model.Task;
import com.github.linkyeeter.model.TaskOutput;
import com.github.linkyeeter.service.media.ThumbnailExtractor;
import com.github.linkyeeter.service.media.VideoExtractor;
import com.github.linkyeeter.service.media.VideoProber;
import com.github.linkyeeter.service.media.VideoTranscoder;
import com.github.linkyeeter.util.FormatUtils;
import com.github.linkyeeter.util.MediaConstants;
import com.github.linkyeeter.util.TempWorkspace;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Turns a URL into an upload-ready video: fetch, size check, probe, bitrate decision,
 * transcode, thumbnail. The first failing stage aborts the rest and the workspace is removed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranscodingPipeline {

    private final LinkYeeterProperties properties;
    private final VideoExtractor extractor;
    private final VideoProber prober;
    private final VideoTranscoder transcoder;
    private final ThumbnailExtractor thumbnailExtractor;
    private final BitratePolicy bitratePolicy;

    /**
     * Run every stage for a task.
     *
     * @param task Task to process
     * @return Output owning its workspace; the caller closes it
     * @throws com.github.linkyeeter.exception.PipelineException if a stage rejects the task
     * @throws IOException if the workspace or a tool cannot be used
     */
    public TaskOutput process(@NonNull Task task) throws IOException {
        LinkYeeterProperties.Processing processing = properties.getProcessing();
        long capMb = processing.capFor(task.isEnableFallback());

        TempWorkspace workspace = TempWorkspace.create(processing.resolveTempPath());
        boolean handedOver = false;
        try {
            Path source = fetch(task, workspace, capMb);
            checkSize(source, capMb);

            ProbeMetadata metadata = prober.probe(source).orElseGet(() -> {
                log.warn("Could not probe {}, continuing without metadata", source.getFileName());
                return ProbeMetadata.unknown();
            });
            log.debug("Probed {}: {}", source.getFileName(), metadata);

            BitrateDecision decision = bitratePolicy.decide(metadata, task.isEnableFallback());

            Path output = workspace.resolve(
                    FormatUtils.randomAlphanumeric(MediaConstants.OUTPUT_NAME_LENGTH) + MediaConstants.VIDEO_EXTENSION);
            Long reducedBitrate = transcode(task, source, output, decision, workspace);
            workspace.deleteFile(source);

            Optional<Path> thumbnail = thumbnailExtractor.extract(output);

            TaskOutput taskOutput = new TaskOutput(workspace, output, thumbnail.orElse(null), metadata, reducedBitrate);
            taskOutput.getReductionPercentage().ifPresent(percentage ->
                    log.info("Bitrate of {} reduced by {}", task.getUrl(), FormatUtils.formatPercentage(percentage)));
            handedOver = true;
            return taskOutput;
        } finally {
            if (!handedOver) {
                workspace.close();
            }
        }
    }

    private Path fetch(Task task, TempWorkspace workspace, long capMb) throws IOException {
        log.info("Downloading {} (cap {} MB)", task.getUrl(), capMb);
        extractor.extract(task.getUrl(), workspace.getDirectory(), capMb);

        List<Path> files = workspace.listFiles();
        if (files.size() != 1) {
            throw ExtractionException.wrongFileCount(task.getUrl(), files.size());
        }
        return files.get(0);
    }

    private void checkSize(Path source, long capMb) throws IOException {
        long bytes = Files.size(source);
        long megabytes = FormatUtils.toWholeMegabytes(bytes);
        if (megabytes > capMb) {
            throw new SizeLimitException(capMb, megabytes);
        }
        log.info("Video downloaded to {} ({})", source, FormatUtils.formatSize(bytes));
    }

    /**
     * Encode the source. An unconstrained attempt that fails is retried once at the
     * computed maximum bitrate, if one is known.
     *
     * @return The reduced bitrate used, or null if the source was encoded unconstrained
     */
    private Long transcode(Task task, Path source, Path output, BitrateDecision decision,
                           TempWorkspace workspace) {
        Long target = decision.getTargetBitrateKbps();
        try {
            transcoder.transcode(source, output, target);
            log.info("Converted the video ({})", FormatUtils.formatBitrate(target));
            return decision.isReduced() ? target : null;
        } catch (IOException e) {
            workspace.deleteFile(output);
            Long retryBitrate = decision.getMaxBitrateKbps();
            if (decision.isReduced() || retryBitrate == null || retryBitrate <= 0) {
                throw transcodeFailure(task, target, e);
            }
            log.warn("Unconstrained conversion of {} failed ({}), retrying at {} kbps",
                    task.getUrl(), e.getMessage(), retryBitrate);
        }

        try {
            transcoder.transcode(source, output, decision.getMaxBitrateKbps());
            log.info("Converted the video (bitrate adjusted to {} kbps)", decision.getMaxBitrateKbps());
            return decision.getMaxBitrateKbps();
        } catch (IOException e) {
            workspace.deleteFile(output);
            throw transcodeFailure(task, decision.getMaxBitrateKbps(), e);
        }
    }

    private TranscodeException transcodeFailure(Task task, Long bitrate, IOException cause) {
        if (cause instanceof ToolFailedException) {
            return new TranscodeException(task.getUrl(), bitrate, ((ToolFailedException) cause).getExitCode(), cause);
        }
        return new TranscodeException(task.getUrl(), bitrate, cause);
    }
}
