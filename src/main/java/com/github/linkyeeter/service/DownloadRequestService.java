package com.github.linkyeeter.service;

import com.github.linkyeeter.model.AdmissionTicket;
import com.github.linkyeeter.model.Submission;
import com.github.linkyeeter.model.Task;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.IntConsumer;

/**
 * Requester side of the queue: reserve a place, tell the user, then enqueue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadRequestService {

    private final TaskManager taskManager;

    public Submission submit(@NonNull String url, boolean enableFallback) {
        return submit(url, enableFallback, position -> { });
    }

    /**
     * Submit a download.
     *
     * @param url Video URL
     * @param enableFallback Raise the size cap and accept any quality loss
     * @param onAccepted Told the queue position before the task is enqueued; if it throws,
     *                   the reservation is released and nothing is enqueued
     * @return Position and pending result
     * @throws IllegalStateException if the service is shutting down
     */
    public Submission submit(@NonNull String url, boolean enableFallback, @NonNull IntConsumer onAccepted) {
        AdmissionTicket ticket = taskManager.tentativeEnqueue();
        try {
            onAccepted.accept(ticket.getPosition());
        } catch (RuntimeException e) {
            ticket.release();
            throw e;
        }

        Task task = Task.of(url, enableFallback);
        taskManager.enqueueTask(ticket, task);
        log.info("Accepted {} at queue position {}{}", url, ticket.getPosition(),
                enableFallback ? " (fallback mode)" : "");
        return new Submission(ticket.getPosition(), task.getCompletion());
    }
}
