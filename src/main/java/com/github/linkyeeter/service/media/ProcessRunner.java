package com.github.linkyeeter.service.media;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs external commands to completion, capturing their merged output.
 * No timeout is applied: a stuck tool blocks its caller.
 */
@Slf4j
@Component
public class ProcessRunner {

    /**
     * Outcome of a finished process.
     */
    public static class ProcessResult {
        private final int exitCode;
        private final String output;

        public ProcessResult(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getOutput() {
            return output;
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * Run a command and wait for it to exit.
     *
     * @param command Command and arguments
     * @param label Short name used in logs
     * @return Exit code and output
     * @throws IOException if the process cannot be started, or the wait is interrupted
     */
    public ProcessResult run(@NonNull List<String> command, @NonNull String label) throws IOException {
        log.debug("Executing {} command: {}", label, String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        Process process = processBuilder.start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
                log.trace("{} output: {}", label, line);
            }
        }

        try {
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("{} exited with code {}:\n{}", label, exitCode, output);
            }
            return new ProcessResult(exitCode, output.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            throw new IOException(label + " interrupted", e);
        }
    }
}
