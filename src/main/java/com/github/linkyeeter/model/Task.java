package com.github.linkyeeter.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.concurrent.CompletableFuture;

/**
 * A download request waiting to be processed by the worker.
 * The completion future is the one-shot reply channel: the worker completes it once,
 * the requester waits on it (or cancels it to stop waiting).
 */
@Getter
@ToString(exclude = "completion")
public class Task {

    private final String url;
    private final boolean enableFallback;
    private final CompletableFuture<TaskResult> completion;

    public Task(@NonNull String url, boolean enableFallback, @NonNull CompletableFuture<TaskResult> completion) {
        this.url = url;
        this.enableFallback = enableFallback;
        this.completion = completion;
    }

    public static Task of(@NonNull String url, boolean enableFallback) {
        return new Task(url, enableFallback, new CompletableFuture<>());
    }

    /**
     * Deliver the result to the requester.
     *
     * @return false if the requester already abandoned the channel or a result was delivered before
     */
    public boolean complete(@NonNull TaskResult result) {
        return completion.complete(result);
    }
}
