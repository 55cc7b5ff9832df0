package com.umitunal.tubeq.model;

import com.umitunal.tubeq.core.Job;

/**
 * Immutable copy of a work unit, taken under the owning tube's lock.
 * This is what tubes hand to consumers, peekers and the journal.
 *
 * @param <T> the type of the job payload
 */
public final class JobSnapshot<T> implements Job<T> {
    private final String id;
    private final String tube;
    private final long priority;
    private final long delaySeconds;
    private final long ttrSeconds;
    private final T payload;
    private final State state;
    private final long createdAt;
    private final String reservedBy;
    private final String buryReason;
    private final long takenAt;
    private final long timeLeftSeconds;
    private final long reserves;
    private final long releases;
    private final long timeouts;
    private final long buries;
    private final long kicks;

    JobSnapshot(WorkUnit<T> unit, long now) {
        this.id = unit.getId();
        this.tube = unit.getTube();
        this.priority = unit.getPriority();
        this.delaySeconds = unit.getDelaySeconds();
        this.ttrSeconds = unit.getTtrSeconds();
        this.payload = unit.getPayload();
        this.state = unit.getState();
        this.createdAt = unit.getCreatedAt();
        this.reservedBy = unit.getReservedBy();
        this.buryReason = unit.getBuryReason();
        this.takenAt = now;
        this.timeLeftSeconds = unit.timeLeftSeconds(now);
        this.reserves = unit.getReserves();
        this.releases = unit.getReleases();
        this.timeouts = unit.getTimeouts();
        this.buries = unit.getBuries();
        this.kicks = unit.getKicks();
    }

    @Override
    public String getId() { return id; }

    @Override
    public String getTube() { return tube; }

    @Override
    public long getPriority() { return priority; }

    @Override
    public long getDelaySeconds() { return delaySeconds; }

    @Override
    public long getTtrSeconds() { return ttrSeconds; }

    @Override
    public T getPayload() { return payload; }

    @Override
    public State getState() { return state; }

    @Override
    public long getCreatedAt() { return createdAt; }

    @Override
    public String getReservedBy() { return reservedBy; }

    @Override
    public long getReserves() { return reserves; }

    @Override
    public long getReleases() { return releases; }

    @Override
    public long getTimeouts() { return timeouts; }

    @Override
    public long getBuries() { return buries; }

    @Override
    public long getKicks() { return kicks; }

    public String getBuryReason() { return buryReason; }

    /**
     * When this snapshot was taken, in milliseconds since epoch.
     */
    public long getTakenAt() { return takenAt; }

    /**
     * Seconds until a delayed job becomes ready or a reservation times out, as of {@link #getTakenAt()}.
     */
    public long getTimeLeftSeconds() { return timeLeftSeconds; }

    /**
     * Seconds since the job was put, as of {@link #getTakenAt()}.
     */
    public long getAgeSeconds() {
        return Math.max(0, (takenAt - createdAt) / 1000);
    }

    @Override
    public String toString() {
        return String.format("Job{id='%s', tube='%s', state=%s, pri=%d, timeLeft=%ds, reserves=%d}",
                id, tube, state, priority, timeLeftSeconds, reserves);
    }
}
