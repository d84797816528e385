package com.github.linkyeeter.model;

import lombok.NonNull;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A tentative place in the queue, handed out before the task itself is enqueued.
 * Settled exactly once: either by enqueueing the task or by releasing the reservation.
 */
public class AdmissionTicket {

    private final int position;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final Consumer<AdmissionTicket> onRelease;

    public AdmissionTicket(int position, @NonNull Consumer<AdmissionTicket> onRelease) {
        this.position = position;
        this.onRelease = onRelease;
    }

    /**
     * Number of tasks ahead of this one when the reservation was made.
     */
    public int getPosition() {
        return position;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * Mark the ticket as used.
     *
     * @return true for the first caller only
     */
    public boolean settle() {
        return settled.compareAndSet(false, true);
    }

    /**
     * Give the reservation back without enqueueing anything. No-op once settled.
     */
    public void release() {
        if (settle()) {
            onRelease.accept(this);
        }
    }

    @Override
    public String toString() {
        return "AdmissionTicket{position=" + position + ", settled=" + settled.get() + "}";
    }
}
