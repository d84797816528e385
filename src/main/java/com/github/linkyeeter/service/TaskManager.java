package com.github.linkyeeter.service;

import com.github.linkyeeter.model.AdmissionTicket;
import com.github.linkyeeter.model.QueueStatus;
import com.github.linkyeeter.model.Task;
import com.github.linkyeeter.model.TaskResult;
import com.github.linkyeeter.util.CancellationToken;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the rest of the application: admission on one side, the worker's lifecycle on the other.
 * Owns the root cancellation token; the worker runs on a child of it.
 */
@Slf4j
@Service
public class TaskManager implements SmartLifecycle {

    static final String SHUTDOWN_REASON = AdmissionController.CLOSED_REASON;

    static final String WORKER_FAILED_REASON = "worker stopped unexpectedly";

    private final AdmissionController admission;
    private final Worker worker;
    private final CancellationToken cancellationToken = new CancellationToken();

    private volatile CompletableFuture<Void> workerLoop;

    public TaskManager(AdmissionController admission, Worker worker) {
        this.admission = admission;
        this.worker = worker;
    }

    /**
     * Get the current queue size, in-flight task included.
     */
    public int getQueueSize() {
        return admission.queueSize();
    }

    /**
     * Get the current queue size and tentatively accept a new task.
     * Keeps the count right between telling a user their position and enqueueing their task.
     *
     * @throws IllegalStateException once the manager is stopped
     */
    public AdmissionTicket tentativeEnqueue() {
        return admission.reserve();
    }

    /**
     * Add a task to the queue, taking the place of its tentative reservation.
     */
    public void enqueueTask(@NonNull AdmissionTicket ticket, @NonNull Task task) {
        admission.enqueue(ticket, task);
    }

    /**
     * Add a task to the queue without a prior reservation.
     */
    public void enqueueTask(@NonNull Task task) {
        admission.enqueue(task);
    }

    public QueueStatus getStatus() {
        return QueueStatus.builder()
                .size(admission.queueSize())
                .workerState(worker.getState())
                .build();
    }

    @Override
    public synchronized void start() {
        if (workerLoop != null) {
            return;
        }
        workerLoop = worker.start(cancellationToken.child());
        workerLoop.whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Worker loop terminated unexpectedly: {}", error.getMessage(), error);
                // nobody is left to run what is queued
                cancellationToken.cancel();
                failPending(WORKER_FAILED_REASON);
            }
        });
        log.debug("task manager started");
    }

    /**
     * Stop the worker after its current task, fail everything still queued and refuse new tasks.
     */
    @Override
    public synchronized void stop() {
        cancellationToken.cancel();
        failPending(SHUTDOWN_REASON);
        log.debug("task manager stopped");
    }

    private void failPending(String reason) {
        List<Task> pending = admission.close();
        for (Task task : pending) {
            task.complete(TaskResult.failure(reason));
        }
        if (!pending.isEmpty()) {
            log.info("Failed {} pending tasks: {}", pending.size(), reason);
        }
    }

    @Override
    public boolean isRunning() {
        return workerLoop != null && !cancellationToken.isCancelled();
    }

    /**
     * Future completing once the worker loop has exited, or null before {@link #start()}.
     */
    CompletableFuture<Void> getWorkerLoop() {
        return workerLoop;
    }
}
