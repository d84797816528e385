package com.github.linkyeeter.service.media;

import com.github.linkyeeter.service.command.MediaCommandBuilder;
import com.github.linkyeeter.util.MediaConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegThumbnailExtractor implements ThumbnailExtractor {

    private final MediaCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;

    @Override
    public Optional<Path> extract(Path videoFile) {
        Path thumbnail = videoFile.resolveSibling(MediaConstants.THUMBNAIL_FILENAME);
        try {
            ProcessRunner.ProcessResult result = processRunner.run(
                    commandBuilder.buildThumbnailCommand(videoFile, thumbnail), "ffmpeg");
            if (result.isSuccess() && Files.exists(thumbnail)) {
                return Optional.of(thumbnail);
            }
            log.warn("No thumbnail for {} (exit code {})", videoFile, result.getExitCode());
        } catch (IOException e) {
            log.warn("Thumbnail extraction failed for {}: {}", videoFile, e.getMessage());
        }
        return Optional.empty();
    }
}
