package com.github.linkyeeter.service.command;

import com.github.linkyeeter.config.LinkYeeterProperties;
import com.github.linkyeeter.util.MediaConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for the command lines of the extractor, the transcoder and the prober.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MediaCommandBuilder {

    private final LinkYeeterProperties properties;

    /**
     * Build the extractor command downloading a single video into a directory.
     *
     * @param url Video page URL
     * @param outputDir Directory the extractor writes into
     * @param maxSizeMb Size cap the extractor must honor
     * @return extractor command arguments
     */
    public List<String> buildExtractCommand(@NonNull String url, @NonNull Path outputDir, long maxSizeMb) {
        List<String> command = new ArrayList<>();
        command.add(properties.getTools().getYtDlp());
        command.add("--no-playlist");
        command.add("--max-filesize");
        command.add(maxSizeMb + "M");
        command.add("--output");
        command.add(outputDir.resolve(MediaConstants.EXTRACTOR_OUTPUT_TEMPLATE).toString());
        command.add(url);

        log.debug("Built extract command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffmpeg command converting a source into an upload-ready MP4.
     *
     * @param inputFile Downloaded source
     * @param outputFile Transcoded file
     * @param bitrateKbps Target video bitrate, or null to keep the encoder's default quality.
     *                    Zero means no room is left for video; the output size cap alone limits it then
     * @return ffmpeg command arguments
     */
    public List<String> buildTranscodeCommand(@NonNull Path inputFile, @NonNull Path outputFile, Long bitrateKbps) {
        List<String> command = new ArrayList<>();
        command.add(properties.getTools().getFfmpeg());
        command.add("-hide_banner");
        command.add("-y");
        command.add("-i");
        command.add(inputFile.toString());
        command.add("-c:v");
        command.add(MediaConstants.FFMPEG_VIDEO_CODEC);
        command.add("-movflags");
        command.add(MediaConstants.FFMPEG_MOVFLAGS);
        command.add("-pix_fmt");
        command.add(MediaConstants.FFMPEG_PIXEL_FORMAT);
        command.add("-b:a");
        command.add(properties.getProcessing().getAudioBitrateKbps() + "k");
        command.add("-fs");
        command.add(properties.getProcessing().getUploadLimitMb() + "M");
        command.add("-vf");
        command.add(MediaConstants.FFMPEG_EVEN_DIMENSIONS_FILTER);

        if (bitrateKbps != null && bitrateKbps > 0) {
            command.add("-b:v");
            command.add(bitrateKbps + "k");
        }

        command.add(outputFile.toString());

        log.debug("Built transcode command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffmpeg command grabbing the first frame of a video as a JPEG.
     */
    public List<String> buildThumbnailCommand(@NonNull Path videoFile, @NonNull Path thumbnailFile) {
        List<String> command = new ArrayList<>();
        command.add(properties.getTools().getFfmpeg());
        command.add("-hide_banner");
        command.add("-y");
        command.add("-i");
        command.add(videoFile.toString());
        command.add("-vframes");
        command.add("1");
        command.add("-q:v");
        command.add(MediaConstants.THUMBNAIL_QUALITY);
        command.add(thumbnailFile.toString());

        log.debug("Built thumbnail command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffprobe command printing format and stream information as JSON.
     */
    public List<String> buildProbeCommand(@NonNull Path file) {
        List<String> command = new ArrayList<>();
        command.add(properties.getTools().getFfprobe());
        command.add("-v");
        command.add("error");
        command.add("-print_format");
        command.add("json");
        command.add("-show_format");
        command.add("-show_streams");
        command.add(file.toString());

        log.debug("Built probe command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build a command that only prints the tool's version, used to check it is installed.
     */
    public List<String> buildVersionCommand(@NonNull String executable) {
        return List.of(executable, executable.contains("yt-dlp") ? "--version" : "-version");
    }
}
