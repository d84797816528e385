package com.github.linkyeeter.service;

import com.github.linkyeeter.config.LinkYeeterProperties;
import com.github.linkyeeter.exception.ConfigurationException;
import com.github.linkyeeter.service.command.MediaCommandBuilder;
import com.github.linkyeeter.service.media.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExternalToolVerifier")
class ExternalToolVerifierTest {

    @Mock
    private ProcessRunner processRunner;

    private LinkYeeterProperties properties;
    private ExternalToolVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new LinkYeeterProperties();
        verifier = new ExternalToolVerifier(properties, new MediaCommandBuilder(properties), processRunner);
    }

    @Test
    @DisplayName("should pass when every tool runs")
    void shouldPassWhenToolsRun() throws IOException {
        when(processRunner.run(anyList(), anyString())).thenReturn(new ProcessRunner.ProcessResult(0, "1.0"));

        assertDoesNotThrow(() -> verifier.verify());

        verify(processRunner).run(eq(List.of("yt-dlp", "--version")), anyString());
        verify(processRunner).run(eq(List.of("ffmpeg", "-version")), anyString());
        verify(processRunner).run(eq(List.of("ffprobe", "-version")), anyString());
    }

    @Test
    @DisplayName("should name the missing tool")
    void shouldNameMissingTool() throws IOException {
        properties.getTools().setFfmpeg("/opt/missing/ffmpeg");
        when(processRunner.run(anyList(), anyString())).thenAnswer(invocation -> {
            List<String> command = invocation.getArgument(0);
            if (command.get(0).startsWith("/opt/missing")) {
                throw new IOException("No such file or directory");
            }
            return new ProcessRunner.ProcessResult(0, "");
        });

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> verifier.verify());

        assertEquals("link-yeeter.tools.ffmpeg", e.getConfigKey());
        assertEquals("/opt/missing/ffmpeg", e.getConfigValue());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("should fail when a tool exits with an error")
    void shouldFailOnNonZeroExit() throws IOException {
        when(processRunner.run(anyList(), anyString())).thenReturn(new ProcessRunner.ProcessResult(127, ""));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> verifier.verify());

        assertEquals("link-yeeter.tools.yt-dlp", e.getConfigKey());
        assertTrue(e.getMessage().contains("exit code 127"));
    }

    @Test
    @DisplayName("should skip verification when disabled")
    void shouldSkipWhenDisabled() {
        properties.getTools().setVerifyOnStartup(false);

        verifier.run(null);

        verifyNoInteractions(processRunner);
    }
}
