package com.github.linkyeeter.exception;

/**
 * Exception thrown when the transcoder failed to produce the output file.
 */
public class TranscodeException extends PipelineException {

    private final String url;
    private final Long bitrateKbps;
    private final Integer exitCode;

    public TranscodeException(String url, Long bitrateKbps, Integer exitCode) {
        super(describe(url, bitrateKbps, exitCode));
        this.url = url;
        this.bitrateKbps = bitrateKbps;
        this.exitCode = exitCode;
    }

    public TranscodeException(String url, Long bitrateKbps, Throwable cause) {
        super(describe(url, bitrateKbps, null), cause);
        this.url = url;
        this.bitrateKbps = bitrateKbps;
        this.exitCode = null;
    }

    public TranscodeException(String url, Long bitrateKbps, Integer exitCode, Throwable cause) {
        super(describe(url, bitrateKbps, exitCode), cause);
        this.url = url;
        this.bitrateKbps = bitrateKbps;
        this.exitCode = exitCode;
    }

    private static String describe(String url, Long bitrateKbps, Integer exitCode) {
        String bitrate = bitrateKbps != null ? bitrateKbps + " kbps" : "no bitrate adjustment";
        String message = "failed to convert the video (" + bitrate + "): " + url;
        return exitCode != null ? message + " [exit code " + exitCode + "]" : message;
    }

    public String getUrl() {
        return url;
    }

    public Long getBitrateKbps() {
        return bitrateKbps;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
