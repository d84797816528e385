package com.github.linkyeeter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;

@Data
@Validated
@ConfigurationProperties(prefix = "link-yeeter")
public class LinkYeeterProperties {

    @Valid
    private Processing processing = new Processing();

    @Valid
    private Tools tools = new Tools();

    @Data
    public static class Processing {
        /**
         * Size ceiling for a downloaded source, in decimal megabytes.
         */
        @Min(1)
        private long maxFilesizeMb = 200;

        /**
         * Multiplier turning the normal size ceiling into the one used in fallback mode.
         */
        @Min(2)
        private int fallbackRatio = 5;

        /**
         * Hard limit of the upload target; the transcoded file must fit into it.
         */
        @Min(1)
        private long uploadLimitMb = 50;

        @Min(0)
        private int audioBitrateKbps = 128;

        @DecimalMin("0.1")
        @DecimalMax("1.0")
        private double containerOverheadFactor = 0.97;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double qualityCutoffRatio = 0.85;

        private String tempPath = "";

        /**
         * Size ceiling used when the requester opted into fallback mode.
         */
        public long getFallbackFilesizeMb() {
            return maxFilesizeMb * fallbackRatio;
        }

        public long capFor(boolean enableFallback) {
            return enableFallback ? getFallbackFilesizeMb() : maxFilesizeMb;
        }

        public Path resolveTempPath() {
            if (tempPath == null || tempPath.isBlank()) {
                return Paths.get(System.getProperty("java.io.tmpdir"));
            }
            return Paths.get(tempPath);
        }
    }

    @Data
    public static class Tools {
        @NotBlank
        private String ytDlp = "yt-dlp";

        @NotBlank
        private String ffmpeg = "ffmpeg";

        @NotBlank
        private String ffprobe = "ffprobe";

        private boolean verifyOnStartup = true;
    }
}
