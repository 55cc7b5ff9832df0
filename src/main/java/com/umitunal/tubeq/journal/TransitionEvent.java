package com.umitunal.tubeq.journal;

import com.umitunal.tubeq.model.JobSnapshot;

/**
 * A committed change to one job, with the job as it stands afterwards.
 *
 * @param <T> the type of the job payload
 */
public class TransitionEvent<T> {
    private final Transition transition;
    private final JobSnapshot<T> job;
    private final String consumerId;

    public TransitionEvent(Transition transition, JobSnapshot<T> job, String consumerId) {
        this.transition = transition;
        this.job = job;
        this.consumerId = consumerId;
    }

    public Transition getTransition() {
        return transition;
    }

    public JobSnapshot<T> getJob() {
        return job;
    }

    /**
     * Consumer that caused the change, or null for producer and timer driven changes.
     */
    public String getConsumerId() {
        return consumerId;
    }

    public long getTimestamp() {
        return job.getTakenAt();
    }

    @Override
    public String toString() {
        return "TransitionEvent{" + transition + " " + job.getTube() + "/" + job.getId() + " -> " + job.getState() + "}";
    }
}
