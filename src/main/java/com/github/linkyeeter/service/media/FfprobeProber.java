package com.github.linkyeeter.service.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.linkyeeter.model.ProbeMetadata;
import com.github.linkyeeter.service.command.MediaCommandBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FfprobeProber implements VideoProber {

    private final MediaCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ProbeMetadata> probe(Path file) {
        try {
            ProcessRunner.ProcessResult result = processRunner.run(commandBuilder.buildProbeCommand(file), "ffprobe");
            if (!result.isSuccess()) {
                log.warn("ffprobe exited with code {} for {}", result.getExitCode(), file);
                return Optional.empty();
            }
            return parse(result.getOutput());
        } catch (IOException e) {
            log.warn("Failed to probe {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parse ffprobe JSON output.
     *
     * @return Metadata, or empty when there is no video stream
     * @throws IOException if the output is not valid JSON
     */
    Optional<ProbeMetadata> parse(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);

        JsonNode videoStream = null;
        for (JsonNode stream : root.path("streams")) {
            if ("video".equals(stream.path("codec_type").asText())) {
                videoStream = stream;
                break;
            }
        }
        if (videoStream == null) {
            return Optional.empty();
        }

        JsonNode format = root.path("format");
        long bitrateKbps = parseLong(format.path("bit_rate").asText("0")) / 1000;
        long durationSeconds = (long) parseDouble(format.path("duration").asText("0"));

        return Optional.of(ProbeMetadata.builder()
                .durationSeconds(Math.max(0, durationSeconds))
                .bitrateKbps(Math.max(0, bitrateKbps))
                .width(Math.max(0, videoStream.path("width").asInt(0)))
                .height(Math.max(0, videoStream.path("height").asInt(0)))
                .build());
    }

    private long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private double parseDouble(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
