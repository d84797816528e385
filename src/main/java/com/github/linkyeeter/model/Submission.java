package com.github.linkyeeter.model;

import lombok.Data;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted task as seen by its requester: the position it was given and its pending result.
 */
@Data
public class Submission {
    private final int position;
    private final CompletableFuture<TaskResult> result;
}
