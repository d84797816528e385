package com.github.linkyeeter.service;

import com.github.linkyeeter.model.Task;
import com.github.linkyeeter.util.CancellationToken;
import lombok.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO handing tasks from requesters to the single worker.
 * The lock may be shared with an owner that needs compound operations over the queue and its own state.
 */
public class WorkQueue {

    private final ReentrantLock lock;
    private final Condition notEmpty;
    private final Deque<Task> items = new ArrayDeque<>();

    public WorkQueue() {
        this(new ReentrantLock());
    }

    public WorkQueue(@NonNull ReentrantLock lock) {
        this.lock = lock;
        this.notEmpty = lock.newCondition();
    }

    /**
     * Append a task. Never blocks.
     */
    public void push(@NonNull Task task) {
        lock.lock();
        try {
            items.addLast(task);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the head of the queue, waiting until one is available.
     * Cancellation is checked before every attempt, so a non-empty queue never hides it.
     *
     * @param token Cancellation signal; whoever cancels it must call {@link #wakeUp()}
     * @return The head task, or empty once cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<Task> pop(@NonNull CancellationToken token) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (token.isCancelled()) {
                    return Optional.empty();
                }
                Task head = items.pollFirst();
                if (head != null) {
                    return Optional.of(head);
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake up a waiting consumer so it re-checks its cancellation token.
     */
    public void wakeUp() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Remove and return every queued task, oldest first.
     */
    public List<Task> drain() {
        lock.lock();
        try {
            List<Task> drained = new ArrayList<>(items);
            items.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
