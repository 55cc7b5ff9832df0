package com.umitunal.tubeq.model;

import com.umitunal.tubeq.core.Job;
import com.umitunal.tubeq.exception.InvalidTransitionException;

import java.util.concurrent.TimeUnit;

/**
 * Mutable job record owned by exactly one tube.
 *
 * <p>A work unit carries no synchronization of its own: every method must be called while the
 * owning tube's lock is held. Deadlines are stored as absolute times ({@code readyAt} for
 * delayed jobs, {@code expiresAt} for reserved ones) so ordered collections can compare them
 * without reading the clock.
 *
 * @param <T> the type of the job payload
 */
public class WorkUnit<T> implements Job<T> {
    /**
     * Smallest time-to-run handed out. Zero would make a reservation expire immediately.
     */
    public static final long MIN_TTR_SECONDS = 1;

    private final String id;
    private final String tube;
    private final T payload;
    private final long ttrSeconds;
    private final long createdAt;

    private long priority;
    private long delaySeconds;
    private State state;
    private long delayStartedAt;
    private long reserveStartedAt;
    private long readyAt;
    private long expiresAt;
    private String reservedBy;
    private String buryReason;
    private long filingSequence;

    private long reserves;
    private long releases;
    private long timeouts;
    private long buries;
    private long kicks;

    public WorkUnit(String id, String tube, long priority, long delaySeconds, long ttrSeconds, T payload, long now) {
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + delaySeconds);
        }
        if (ttrSeconds < 0) {
            throw new IllegalArgumentException("ttr must not be negative: " + ttrSeconds);
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        this.id = id;
        this.tube = tube;
        this.priority = priority;
        this.delaySeconds = delaySeconds;
        this.ttrSeconds = Math.max(MIN_TTR_SECONDS, ttrSeconds);
        this.payload = payload;
        this.createdAt = now;

        if (delaySeconds > 0) {
            this.state = State.DELAYED;
            startDelay(now);
        } else {
            this.state = State.READY;
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTube() {
        return tube;
    }

    @Override
    public long getPriority() {
        return priority;
    }

    @Override
    public long getDelaySeconds() {
        return delaySeconds;
    }

    @Override
    public long getTtrSeconds() {
        return ttrSeconds;
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String getReservedBy() {
        return reservedBy;
    }

    @Override
    public long getReserves() {
        return reserves;
    }

    @Override
    public long getReleases() {
        return releases;
    }

    @Override
    public long getTimeouts() {
        return timeouts;
    }

    @Override
    public long getBuries() {
        return buries;
    }

    @Override
    public long getKicks() {
        return kicks;
    }

    public long getDelayStartedAt() {
        return delayStartedAt;
    }

    public long getReserveStartedAt() {
        return reserveStartedAt;
    }

    public long getReadyAt() {
        return readyAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public String getBuryReason() {
        return buryReason;
    }

    /**
     * Tie-breaker assigned by the tube each time the unit is filed into a collection.
     * Must not change while the unit sits in an ordered collection.
     */
    public long getFilingSequence() {
        return filingSequence;
    }

    public void setFilingSequence(long filingSequence) {
        this.filingSequence = filingSequence;
    }

    /**
     * Moves the unit to {@code target}, recording the entry timestamp the target needs.
     *
     * @throws InvalidTransitionException if the lifecycle has no edge from the current state
     *         to {@code target}; the state is left unchanged
     */
    public void transition(State target, long now) throws InvalidTransitionException {
        switch (target) {
            case READY -> {
                if (state == State.READY) {
                    throw new InvalidTransitionException(id, state, target);
                }
                reservedBy = null;
            }
            case DELAYED -> {
                if (state != State.RESERVED) {
                    throw new InvalidTransitionException(id, state, target);
                }
                reservedBy = null;
                startDelay(now);
            }
            case RESERVED -> {
                if (state != State.READY) {
                    throw new InvalidTransitionException(id, state, target);
                }
                reserveStartedAt = now;
                expiresAt = deadline(now, ttrSeconds);
            }
            case BURIED -> {
                if (state != State.RESERVED) {
                    throw new InvalidTransitionException(id, state, target);
                }
                reservedBy = null;
            }
        }
        state = target;
    }

    /**
     * Ordering key for the current state: the priority while ready, the milliseconds left
     * until the deadline while delayed or reserved, and zero while buried.
     */
    public long key(long now) {
        return switch (state) {
            case READY -> priority;
            case DELAYED -> readyAt - now;
            case RESERVED -> expiresAt - now;
            case BURIED -> 0;
        };
    }

    /**
     * Whole seconds left before a delayed job becomes ready or a reservation times out.
     */
    public long timeLeftSeconds(long now) {
        if (state != State.DELAYED && state != State.RESERVED) {
            return 0;
        }
        return Math.max(0, TimeUnit.MILLISECONDS.toSeconds(key(now)));
    }

    public boolean isDue(long now) {
        return (state == State.DELAYED || state == State.RESERVED) && key(now) <= 0;
    }

    public void reserve(String consumerId, long now) throws InvalidTransitionException {
        transition(State.RESERVED, now);
        reservedBy = consumerId;
        reserves++;
    }

    /**
     * Returns a reserved unit to the ready or delayed state with a new priority.
     */
    public void release(long newPriority, long newDelaySeconds, long now) throws InvalidTransitionException {
        if (newDelaySeconds < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + newDelaySeconds);
        }
        if (state != State.RESERVED) {
            throw new InvalidTransitionException(id, state, newDelaySeconds > 0 ? State.DELAYED : State.READY);
        }
        long previousDelay = delaySeconds;
        delaySeconds = newDelaySeconds;
        try {
            transition(newDelaySeconds > 0 ? State.DELAYED : State.READY, now);
        } catch (InvalidTransitionException e) {
            delaySeconds = previousDelay;
            throw e;
        }
        priority = newPriority;
        releases++;
    }

    public void bury(long newPriority, String reason, long now) throws InvalidTransitionException {
        transition(State.BURIED, now);
        priority = newPriority;
        buryReason = reason;
        buries++;
    }

    /**
     * Moves a buried or delayed unit straight to ready.
     */
    public void kick(long now) throws InvalidTransitionException {
        if (state != State.BURIED && state != State.DELAYED) {
            throw new InvalidTransitionException(id, state, State.READY);
        }
        transition(State.READY, now);
        kicks++;
    }

    /**
     * Forced release of a reservation whose time-to-run ran out.
     */
    public void timeOut(long now) throws InvalidTransitionException {
        if (state != State.RESERVED) {
            throw new InvalidTransitionException(id, state, State.READY);
        }
        transition(State.READY, now);
        timeouts++;
    }

    /**
     * Promotes a delayed unit whose delay has elapsed.
     */
    public void promote(long now) throws InvalidTransitionException {
        if (state != State.DELAYED) {
            throw new InvalidTransitionException(id, state, State.READY);
        }
        transition(State.READY, now);
    }

    /**
     * Hands back a reservation whose consumer went away without seeing the job.
     * Not counted as a client release.
     */
    public void abandon(long now) throws InvalidTransitionException {
        if (state != State.RESERVED) {
            throw new InvalidTransitionException(id, state, State.READY);
        }
        transition(State.READY, now);
    }

    /**
     * Restarts the time-to-run window of a reserved unit.
     */
    public void touch(long now) throws InvalidTransitionException {
        if (state != State.RESERVED) {
            throw new InvalidTransitionException(id, state, State.RESERVED);
        }
        reserveStartedAt = now;
        expiresAt = deadline(now, ttrSeconds);
    }

    public JobSnapshot<T> snapshot(long now) {
        return new JobSnapshot<>(this, now);
    }

    private void startDelay(long now) {
        delayStartedAt = now;
        readyAt = deadline(now, delaySeconds);
    }

    /**
     * {@code now} plus {@code seconds}, pinned to {@link Long#MAX_VALUE} instead of wrapping.
     */
    static long deadline(long now, long seconds) {
        long millis = TimeUnit.SECONDS.toMillis(seconds);
        return millis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + millis;
    }

    @Override
    public String toString() {
        return String.format("WorkUnit{id='%s', tube='%s', state=%s, pri=%d, delay=%d, ttr=%d, reservedBy='%s'}",
                id, tube, state, priority, delaySeconds, ttrSeconds, reservedBy);
    }
}
