package com.github.linkyeeter.util;

/**
 * Constants used throughout the processing pipeline.
 */
public final class MediaConstants {

    private MediaConstants() {
        // Utility class, no instantiation
    }

    // ========== Size Units ==========

    /**
     * Bytes in one megabyte (decimal, not binary).
     */
    public static final long BYTES_PER_MB = 1_000_000L;

    /**
     * Kilobits in one megabyte: 8 bits per byte, 1000 kilobytes per megabyte.
     */
    public static final long KILOBITS_PER_MB = 8_000L;

    // ========== File Naming ==========

    /**
     * Video file extension for transcoded output.
     */
    public static final String VIDEO_EXTENSION = ".mp4";

    /**
     * Thumbnail file name, placed next to the transcoded video.
     */
    public static final String THUMBNAIL_FILENAME = "thumbnail.jpg";

    /**
     * Length of the random part of generated output names.
     */
    public static final int OUTPUT_NAME_LENGTH = 10;

    /**
     * Extractor output template; the extractor substitutes the id and extension.
     */
    public static final String EXTRACTOR_OUTPUT_TEMPLATE = "%(id)s.%(ext)s";

    /**
     * Prefix of per-task workspace directories.
     */
    public static final String WORKSPACE_PREFIX = "link-yeeter-";

    // ========== FFmpeg Configuration ==========

    public static final String FFMPEG_VIDEO_CODEC = "libx264";

    public static final String FFMPEG_PIXEL_FORMAT = "yuv420p";

    public static final String FFMPEG_MOVFLAGS = "+faststart";

    /**
     * Crop filter keeping both dimensions even, which libx264 with yuv420p requires.
     */
    public static final String FFMPEG_EVEN_DIMENSIONS_FILTER = "crop=trunc(iw/2)*2:trunc(ih/2)*2";

    /**
     * JPEG quality of the thumbnail (1 best, 31 worst).
     */
    public static final String THUMBNAIL_QUALITY = "3";

    // ========== Extractor Output ==========

    /**
     * Message the extractor prints when it refuses a file for exceeding --max-filesize.
     */
    public static final String EXTRACTOR_OVERSIZE_MARKER = "larger than max-filesize";
}
