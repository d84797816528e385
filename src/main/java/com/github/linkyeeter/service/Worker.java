package com.github.linkyeeter.service;

import com.github.linkyeeter.exception.ChannelClosedException;
import com.github.linkyeeter.exception.PipelineException;
import com.github.linkyeeter.model.Task;
import com.github.linkyeeter.model.TaskOutput;
import com.github.linkyeeter.model.TaskResult;
import com.github.linkyeeter.model.WorkerState;
import com.github.linkyeeter.service.state.WorkerStateMachine;
import com.github.linkyeeter.util.CancellationToken;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Processes tasks one at a time, in arrival order, until cancelled.
 * A failing task turns into a failure result for that task only; the loop keeps going.
 */
@Slf4j
@Service
public class Worker {

    private final AdmissionController admission;
    private final TranscodingPipeline pipeline;
    private final WorkerStateMachine stateMachine;
    private final Executor executor;

    private final AtomicReference<CancellationToken> cancellationToken = new AtomicReference<>();
    private volatile WorkerState state = WorkerState.IDLE;

    public Worker(AdmissionController admission, TranscodingPipeline pipeline,
                  WorkerStateMachine stateMachine, @Qualifier("workerExecutor") Executor executor) {
        this.admission = admission;
        this.pipeline = pipeline;
        this.stateMachine = stateMachine;
        this.executor = executor;
    }

    /**
     * Start the worker loop on the worker executor.
     *
     * @param token Cancellation signal; the loop stops after the current task once it fires
     * @return Future completing when the loop has stopped
     * @throws IllegalStateException if the worker was started before
     */
    public CompletableFuture<Void> start(@NonNull CancellationToken token) {
        if (!cancellationToken.compareAndSet(null, token)) {
            throw new IllegalStateException("Worker already started");
        }
        token.onCancel(admission::wakeUp);
        return CompletableFuture.runAsync(() -> run(token), executor);
    }

    /**
     * Signal cancellation. An in-flight task still runs to completion.
     */
    public void stop() {
        CancellationToken token = cancellationToken.get();
        if (token != null) {
            token.cancel();
        }
    }

    public WorkerState getState() {
        return state;
    }

    private void run(CancellationToken token) {
        log.debug("worker started");
        try {
            while (!token.isCancelled()) {
                Optional<Task> next = admission.claimNext(token);
                if (next.isEmpty()) {
                    continue;
                }
                changeState(WorkerState.BUSY);
                try {
                    handleTask(next.get());
                } finally {
                    admission.completeInFlight();
                    changeState(WorkerState.IDLE);
                }
            }
            log.debug("worker cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted, stopping");
        } finally {
            changeState(WorkerState.STOPPED);
            log.debug("worker stopped");
        }
    }

    /**
     * Run the pipeline for a task and send the result back to the requester.
     */
    void handleTask(Task task) {
        log.info("Processing task: {}", task.getUrl());
        TaskResult result;
        try {
            result = process(task);
        } catch (Error e) {
            // the loop cannot go on, but the requester still gets an answer
            log.error("Fatal error processing task {}: {}", task.getUrl(), e.toString(), e);
            task.complete(TaskResult.failure("internal error: " + e, e));
            throw e;
        }
        log.info("Finished task {}: {}", task.getUrl(), result.describe());

        if (!task.complete(result)) {
            ChannelClosedException e = new ChannelClosedException(task.getUrl());
            log.error("{} [{}]", e.getMessage(), task.getUrl());
            // nobody will ever read the output, free its directory now
            result.getOutputIfPresent().ifPresent(TaskOutput::close);
        }
    }

    private TaskResult process(Task task) {
        try {
            return TaskResult.success(pipeline.process(task));
        } catch (PipelineException e) {
            log.warn("Task {} failed: {}", task.getUrl(), e.getMessage());
            return TaskResult.failure(e);
        } catch (Exception e) {
            log.error("Error processing task {}: {}", task.getUrl(), e.getMessage(), e);
            return TaskResult.failure(e);
        }
    }

    private void changeState(WorkerState newState) {
        state = stateMachine.transition(state, newState);
    }
}
