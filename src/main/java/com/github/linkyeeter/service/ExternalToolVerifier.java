package com.github.linkyeeter.service;

import com.github.linkyeeter.config.LinkYeeterProperties;
import com.github.linkyeeter.exception.ConfigurationException;
import com.github.linkyeeter.service.command.MediaCommandBuilder;
import com.github.linkyeeter.service.media.ProcessRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Makes sure the extractor, transcoder and prober can be run before any task is accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExternalToolVerifier implements ApplicationRunner {

    private final LinkYeeterProperties properties;
    private final MediaCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getTools().isVerifyOnStartup()) {
            log.info("Skipping external tool verification");
            return;
        }
        verify();
    }

    /**
     * Run each tool's version command.
     *
     * @throws ConfigurationException naming the first tool that cannot be run
     */
    public void verify() {
        Map<String, String> tools = new LinkedHashMap<>();
        tools.put("link-yeeter.tools.yt-dlp", properties.getTools().getYtDlp());
        tools.put("link-yeeter.tools.ffmpeg", properties.getTools().getFfmpeg());
        tools.put("link-yeeter.tools.ffprobe", properties.getTools().getFfprobe());

        for (Map.Entry<String, String> tool : tools.entrySet()) {
            String executable = tool.getValue();
            try {
                ProcessRunner.ProcessResult result =
                        processRunner.run(commandBuilder.buildVersionCommand(executable), executable);
                if (!result.isSuccess()) {
                    throw new ConfigurationException("failed to run " + executable + " (exit code "
                            + result.getExitCode() + ")", tool.getKey(), executable);
                }
            } catch (IOException e) {
                throw new ConfigurationException("failed to find " + executable + " in PATH",
                        tool.getKey(), executable, e);
            }
            log.debug("Found {}", executable);
        }
        log.info("External tools verified");
    }
}
