package com.umitunal.tubeq.exception;

/**
 * Thrown when release, bury, touch or delete targets a job that the calling consumer does not hold.
 */
public class NotReservedException extends TubeException {

    public NotReservedException(String jobId, String consumerId) {
        super("Job " + jobId + " is not reserved by " + consumerId, jobId);
    }
}
