package com.github.linkyeeter.exception;

/**
 * Exception thrown when the extractor could not produce exactly one source file.
 */
public class ExtractionException extends PipelineException {

    public enum Reason {
        OVERSIZED,
        NON_ZERO_EXIT,
        WRONG_FILE_COUNT
    }

    private final Reason reason;
    private final String url;
    private final Integer exitCode;
    private final Integer fileCount;

    private ExtractionException(String message, Reason reason, String url, Integer exitCode, Integer fileCount) {
        super(message);
        this.reason = reason;
        this.url = url;
        this.exitCode = exitCode;
        this.fileCount = fileCount;
    }

    public static ExtractionException oversized(String url, long capMb) {
        return new ExtractionException("source file exceeded " + capMb + " MB",
                Reason.OVERSIZED, url, null, null);
    }

    public static ExtractionException nonZeroExit(String url, int exitCode) {
        return new ExtractionException("extractor exited with code " + exitCode,
                Reason.NON_ZERO_EXIT, url, exitCode, null);
    }

    public static ExtractionException wrongFileCount(String url, int fileCount) {
        return new ExtractionException(fileCount + " files found, expected 1",
                Reason.WRONG_FILE_COUNT, url, null, fileCount);
    }

    public Reason getReason() {
        return reason;
    }

    public String getUrl() {
        return url;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public Integer getFileCount() {
        return fileCount;
    }
}
