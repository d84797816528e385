package com.github.linkyeeter.service;

import com.github.linkyeeter.model.AdmissionTicket;
import com.github.linkyeeter.model.Task;
import com.github.linkyeeter.util.CancellationToken;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps count of every task a requester has been told about: queued, tentatively
 * reserved, and the one in flight. All three are read and changed under one lock,
 * shared with the work queue, so no task is ever counted twice or not at all.
 */
@Slf4j
@Component
public class AdmissionController {

    static final String CLOSED_REASON = "service is shutting down";

    private final ReentrantLock lock = new ReentrantLock();
    private final WorkQueue queue = new WorkQueue(lock);

    // guarded by lock
    private int tentativeCount = 0;
    private boolean inFlight = false;
    private boolean closed = false;

    /**
     * Number of queued, reserved and in-flight tasks.
     */
    public int queueSize() {
        lock.lock();
        try {
            return queue.size() + tentativeCount + (inFlight ? 1 : 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Report the current queue size and reserve the next place for a task that is about to be enqueued.
     *
     * @return Ticket holding the reported position; settle it with {@link #enqueue(AdmissionTicket, Task)}
     *         or {@link AdmissionTicket#release()}
     * @throws IllegalStateException once admission is closed
     */
    public AdmissionTicket reserve() {
        lock.lock();
        try {
            ensureOpen();
            int position = queue.size() + tentativeCount + (inFlight ? 1 : 0);
            tentativeCount++;
            log.debug("Reserved queue position {} ({} tentative)", position, tentativeCount);
            return new AdmissionTicket(position, this::releaseReservation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueue a task that holds no reservation.
     *
     * @throws IllegalStateException once admission is closed
     */
    public void enqueue(@NonNull Task task) {
        lock.lock();
        try {
            ensureOpen();
            queue.push(task);
            log.debug("Enqueued {}", task.getUrl());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueue a task in place of its reservation. Both happen in the same guarded region.
     *
     * A reservation made before admission closed is dropped instead.
     *
     * @throws IllegalStateException if the ticket was already used or released, or admission is closed
     */
    public void enqueue(@NonNull AdmissionTicket ticket, @NonNull Task task) {
        lock.lock();
        try {
            if (!ticket.settle()) {
                throw new IllegalStateException("Admission ticket already settled: " + ticket);
            }
            decrementTentative();
            ensureOpen();
            queue.push(task);
            log.debug("Enqueued {} at reserved position {}", task.getUrl(), ticket.getPosition());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next task for the worker and mark it in flight atomically.
     * Waits for a task; returns empty once the token is cancelled.
     */
    Optional<Task> claimNext(@NonNull CancellationToken token) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            Optional<Task> next = queue.pop(token);
            if (next.isPresent()) {
                inFlight = true;
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Free the in-flight slot after the task's result was delivered.
     */
    void completeInFlight() {
        lock.lock();
        try {
            inFlight = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake the worker if it is waiting for a task.
     */
    void wakeUp() {
        queue.wakeUp();
    }

    /**
     * Stop accepting tasks and remove all tasks still waiting in the queue, in one step,
     * so nothing can be enqueued behind the drain. The in-flight task is left alone.
     *
     * @return Tasks that were waiting, oldest first
     */
    List<Task> close() {
        lock.lock();
        try {
            closed = true;
            return queue.drain();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    int getTentativeCount() {
        lock.lock();
        try {
            return tentativeCount;
        } finally {
            lock.unlock();
        }
    }

    boolean isInFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    private void releaseReservation(AdmissionTicket ticket) {
        lock.lock();
        try {
            decrementTentative();
            log.debug("Released reservation at position {}", ticket.getPosition());
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(CLOSED_REASON);
        }
    }

    private void decrementTentative() {
        if (tentativeCount == 0) {
            throw new IllegalStateException("No tentative reservation to reconcile");
        }
        tentativeCount--;
    }
}
