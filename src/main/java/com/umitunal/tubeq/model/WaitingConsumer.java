package com.umitunal.tubeq.model;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A consumer blocked on reserve, waiting for the dispatcher to hand it a job.
 *
 * <p>The delivery slot is one-shot: exactly one of {@link #deliver} and {@link #abandon}
 * succeeds, once. The owning tube calls both under its lock; only {@link #await} runs
 * outside it.
 *
 * @param <T> the type of the job payload
 */
public class WaitingConsumer<T> {
    private final String id;
    private final String consumerId;
    private final long registeredAt;
    private final CompletableFuture<JobSnapshot<T>> slot = new CompletableFuture<>();

    public WaitingConsumer(String id, String consumerId, long registeredAt) {
        this.id = id;
        this.consumerId = consumerId;
        this.registeredAt = registeredAt;
    }

    public String getId() {
        return id;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }

    /**
     * Fills the slot and wakes the waiting caller.
     *
     * @return false if the slot was already filled or abandoned
     */
    public boolean deliver(JobSnapshot<T> job) {
        return slot.complete(job);
    }

    /**
     * Closes the slot without a job.
     *
     * @return false if a job was delivered first
     */
    public boolean abandon() {
        return slot.cancel(false);
    }

    public boolean isClosed() {
        return slot.isDone();
    }

    /**
     * The delivered job, if one was delivered.
     */
    public Optional<JobSnapshot<T>> delivered() {
        if (!slot.isDone() || slot.isCancelled()) {
            return Optional.empty();
        }
        return Optional.of(slot.join());
    }

    /**
     * Blocks until a job is delivered.
     */
    public JobSnapshot<T> await() throws InterruptedException {
        try {
            return slot.get();
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("Delivery slot " + id + " closed without a job", e);
        }
    }

    /**
     * Blocks until a job is delivered or {@code timeout} elapses. Timeouts too long to count
     * in nanoseconds wait for about 292 years.
     */
    public JobSnapshot<T> await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return slot.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("Delivery slot " + id + " closed without a job", e);
        }
    }

    @Override
    public String toString() {
        return "WaitingConsumer{id='" + id + "', consumer='" + consumerId + "', closed=" + isClosed() + "}";
    }
}
