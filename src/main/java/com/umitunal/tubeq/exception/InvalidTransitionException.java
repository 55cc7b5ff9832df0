package com.umitunal.tubeq.exception;

import com.umitunal.tubeq.core.Job;

/**
 * Thrown when a job is asked to move along an edge its lifecycle does not have.
 */
public class InvalidTransitionException extends TubeException {
    private final Job.State from;
    private final Job.State to;

    public InvalidTransitionException(String jobId, Job.State from, Job.State to) {
        super("Invalid state transition " + from + " -> " + to + " for job " + jobId, jobId);
        this.from = from;
        this.to = to;
    }

    public Job.State getFrom() {
        return from;
    }

    public Job.State getTo() {
        return to;
    }
}
