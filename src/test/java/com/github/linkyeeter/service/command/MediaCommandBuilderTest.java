package com.github.linkyeeter.service.command;

import com.github.linkyeeter.config.LinkYeeterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaCommandBuilder")
class MediaCommandBuilderTest {

    private LinkYeeterProperties properties;
    private MediaCommandBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new LinkYeeterProperties();
        builder = new MediaCommandBuilder(properties);
    }

    private static String valueAfter(List<String> command, String flag) {
        int index = command.indexOf(flag);
        assertTrue(index >= 0, "missing " + flag);
        return command.get(index + 1);
    }

    @Nested
    @DisplayName("extract command")
    class ExtractTests {

        @Test
        @DisplayName("should pass the size cap and output template")
        void shouldPassCapAndTemplate() {
            Path dir = Paths.get("/tmp/work");

            List<String> command = builder.buildExtractCommand("https://example.com/v", dir, 200);

            assertEquals("yt-dlp", command.get(0));
            assertEquals("200M", valueAfter(command, "--max-filesize"));
            assertEquals(dir.resolve("%(id)s.%(ext)s").toString(), valueAfter(command, "--output"));
            assertTrue(command.contains("--no-playlist"));
            assertEquals("https://example.com/v", command.get(command.size() - 1));
        }

        @Test
        @DisplayName("should use the configured executable")
        void shouldUseConfiguredExecutable() {
            properties.getTools().setYtDlp("/usr/local/bin/yt-dlp");

            List<String> command = builder.buildExtractCommand("https://example.com/v", Paths.get("/tmp"), 1000);

            assertEquals("/usr/local/bin/yt-dlp", command.get(0));
            assertEquals("1000M", valueAfter(command, "--max-filesize"));
        }
    }

    @Nested
    @DisplayName("transcode command")
    class TranscodeTests {

        private final Path input = Paths.get("/tmp/work/source.webm");
        private final Path output = Paths.get("/tmp/work/out.mp4");

        @Test
        @DisplayName("should cap the output file at the upload limit")
        void shouldCapOutputSize() {
            List<String> command = builder.buildTranscodeCommand(input, output, null);

            assertEquals("ffmpeg", command.get(0));
            assertEquals(input.toString(), valueAfter(command, "-i"));
            assertEquals("50M", valueAfter(command, "-fs"));
            assertEquals("128k", valueAfter(command, "-b:a"));
            assertEquals("libx264", valueAfter(command, "-c:v"));
            assertEquals("yuv420p", valueAfter(command, "-pix_fmt"));
            assertEquals("crop=trunc(iw/2)*2:trunc(ih/2)*2", valueAfter(command, "-vf"));
            assertEquals(output.toString(), command.get(command.size() - 1));
        }

        @Test
        @DisplayName("should omit the video bitrate when unconstrained")
        void shouldOmitBitrateWhenUnconstrained() {
            List<String> command = builder.buildTranscodeCommand(input, output, null);

            assertFalse(command.contains("-b:v"));
        }

        @Test
        @DisplayName("should leave the size cap alone in charge at zero bitrate")
        void shouldOmitBitrateAtZero() {
            List<String> command = builder.buildTranscodeCommand(input, output, 0L);

            assertFalse(command.contains("-b:v"));
            assertFalse(command.contains("0k"));
            assertEquals("50M", valueAfter(command, "-fs"));
        }

        @Test
        @DisplayName("should set the video bitrate when given")
        void shouldSetBitrate() {
            List<String> command = builder.buildTranscodeCommand(input, output, 522L);

            assertEquals("522k", valueAfter(command, "-b:v"));
            assertEquals(output.toString(), command.get(command.size() - 1));
        }
    }

    @Test
    @DisplayName("probe command should request JSON format and streams")
    void probeCommandShouldRequestJson() {
        Path file = Paths.get("/tmp/work/source.webm");

        List<String> command = builder.buildProbeCommand(file);

        assertEquals("ffprobe", command.get(0));
        assertEquals("json", valueAfter(command, "-print_format"));
        assertTrue(command.contains("-show_format"));
        assertTrue(command.contains("-show_streams"));
        assertEquals(file.toString(), command.get(command.size() - 1));
    }

    @Test
    @DisplayName("thumbnail command should grab a single frame")
    void thumbnailCommandShouldGrabOneFrame() {
        List<String> command = builder.buildThumbnailCommand(
                Paths.get("/tmp/work/out.mp4"), Paths.get("/tmp/work/thumbnail.jpg"));

        assertEquals("1", valueAfter(command, "-vframes"));
        assertEquals("/tmp/work/thumbnail.jpg", command.get(command.size() - 1));
    }

    @Test
    @DisplayName("version command should match each tool's flag")
    void versionCommandShouldMatchTool() {
        assertEquals(List.of("yt-dlp", "--version"), builder.buildVersionCommand("yt-dlp"));
        assertEquals(List.of("ffmpeg", "-version"), builder.buildVersionCommand("ffmpeg"));
    }
}
