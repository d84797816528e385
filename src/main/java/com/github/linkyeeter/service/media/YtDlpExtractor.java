package com.github.linkyeeter.service.media;

import com.github.linkyeeter.exception.ExtractionException;
import com.github.linkyeeter.service.command.MediaCommandBuilder;
import com.github.linkyeeter.util.MediaConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class YtDlpExtractor implements VideoExtractor {

    private final MediaCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;

    @Override
    public void extract(String url, Path outputDir, long maxSizeMb) throws IOException {
        ProcessRunner.ProcessResult result = processRunner.run(
                commandBuilder.buildExtractCommand(url, outputDir, maxSizeMb), "yt-dlp");

        // the extractor skips oversized files instead of failing, so look for its notice first
        if (result.getOutput().contains(MediaConstants.EXTRACTOR_OVERSIZE_MARKER)) {
            log.info("Source of {} exceeds {} MB", url, maxSizeMb);
            throw ExtractionException.oversized(url, maxSizeMb);
        }
        if (!result.isSuccess()) {
            log.error("yt-dlp exited with code {} for {}", result.getExitCode(), url);
            throw ExtractionException.nonZeroExit(url, result.getExitCode());
        }
        log.debug("Downloaded {} into {}", url, outputDir);
    }
}
