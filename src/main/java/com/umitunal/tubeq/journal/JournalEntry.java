package com.umitunal.tubeq.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.tubeq.core.Job;

/**
 * Stored form of a transition. The payload is only written with {@link Transition#PUT}
 * entries; later entries for the same job refer back to it by id.
 */
public final class JournalEntry {
    private final long sequence;
    private final Transition transition;
    private final String tube;
    private final String jobId;
    private final Job.State state;
    private final long priority;
    private final long delaySeconds;
    private final long ttrSeconds;
    private final String consumerId;
    private final long timestamp;
    private final byte[] payload;

    @JsonCreator
    public JournalEntry(@JsonProperty("sequence") long sequence,
                        @JsonProperty("transition") Transition transition,
                        @JsonProperty("tube") String tube,
                        @JsonProperty("jobId") String jobId,
                        @JsonProperty("state") Job.State state,
                        @JsonProperty("priority") long priority,
                        @JsonProperty("delaySeconds") long delaySeconds,
                        @JsonProperty("ttrSeconds") long ttrSeconds,
                        @JsonProperty("consumerId") String consumerId,
                        @JsonProperty("timestamp") long timestamp,
                        @JsonProperty("payload") byte[] payload) {
        this.sequence = sequence;
        this.transition = transition;
        this.tube = tube;
        this.jobId = jobId;
        this.state = state;
        this.priority = priority;
        this.delaySeconds = delaySeconds;
        this.ttrSeconds = ttrSeconds;
        this.consumerId = consumerId;
        this.timestamp = timestamp;
        this.payload = payload;
    }

    public long getSequence() { return sequence; }
    public Transition getTransition() { return transition; }
    public String getTube() { return tube; }
    public String getJobId() { return jobId; }
    public Job.State getState() { return state; }
    public long getPriority() { return priority; }
    public long getDelaySeconds() { return delaySeconds; }
    public long getTtrSeconds() { return ttrSeconds; }
    public String getConsumerId() { return consumerId; }
    public long getTimestamp() { return timestamp; }
    public byte[] getPayload() { return payload; }

    @Override
    public String toString() {
        return String.format("JournalEntry{#%d %s %s/%s state=%s pri=%d}",
                sequence, transition, tube, jobId, state, priority);
    }
}
