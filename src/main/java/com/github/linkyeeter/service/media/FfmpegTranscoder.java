package com.github.linkyeeter.service.media;

import com.github.linkyeeter.exception.ToolFailedException;
import com.github.linkyeeter.service.command.MediaCommandBuilder;
import com.github.linkyeeter.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegTranscoder implements VideoTranscoder {

    private final MediaCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;

    @Override
    public void transcode(Path input, Path output, Long bitrateKbps) throws IOException {
        ProcessRunner.ProcessResult result = processRunner.run(
                commandBuilder.buildTranscodeCommand(input, output, bitrateKbps), "ffmpeg");

        if (!result.isSuccess()) {
            log.error("ffmpeg transcode ({}) exited with code {}",
                    FormatUtils.formatBitrate(bitrateKbps), result.getExitCode());
            throw new ToolFailedException("ffmpeg", result.getExitCode());
        }
    }
}
