package com.github.linkyeeter.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * Result of processing a task: either the produced output or a failure reason.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskResult {

    private final boolean success;

    private final TaskOutput output;

    private final String failureReason;

    private final Throwable cause;

    public static TaskResult success(@NonNull TaskOutput output) {
        return new TaskResult(true, output, null, null);
    }

    public static TaskResult failure(@NonNull String reason) {
        return new TaskResult(false, null, reason, null);
    }

    public static TaskResult failure(@NonNull String reason, Throwable cause) {
        return new TaskResult(false, null, reason, cause);
    }

    public static TaskResult failure(@NonNull Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TaskResult(false, null, reason, cause);
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<TaskOutput> getOutputIfPresent() {
        return Optional.ofNullable(output);
    }

    /**
     * Get user-friendly description of this result.
     */
    public String describe() {
        if (success) {
            return output.getReducedBitrateKbps()
                    .map(kbps -> "Processed (bitrate reduced to " + kbps + " kbps)")
                    .orElse("Processed");
        }
        return "Failed: " + failureReason;
    }

    @Override
    public String toString() {
        return success ? "TaskResult{success, " + output + "}" : "TaskResult{failure='" + failureReason + "'}";
    }
}
