package com.github.linkyeeter.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binds application.yml with only the MAX_FILESIZE environment setting overridden.
 */
@SpringBootTest(
        classes = ApplicationYamlBindingTest.PropertiesConfig.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "MAX_FILESIZE=1500")
@DisplayName("application.yml binding")
class ApplicationYamlBindingTest {

    @Configuration
    @EnableConfigurationProperties(LinkYeeterProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private LinkYeeterProperties properties;

    @Test
    @DisplayName("MAX_FILESIZE alone should raise both caps")
    void maxFilesizeAloneShouldRaiseBothCaps() {
        LinkYeeterProperties.Processing processing = properties.getProcessing();

        assertEquals(1500, processing.getMaxFilesizeMb());
        assertEquals(5, processing.getFallbackRatio());
        assertEquals(1500, processing.capFor(false));
        assertEquals(7500, processing.capFor(true));
    }

    @Test
    @DisplayName("other settings should keep their defaults")
    void otherSettingsShouldKeepDefaults() {
        assertEquals(50, properties.getProcessing().getUploadLimitMb());
        assertEquals("ffmpeg", properties.getTools().getFfmpeg());
    }
}
