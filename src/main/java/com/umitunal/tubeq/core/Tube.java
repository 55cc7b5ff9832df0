package com.umitunal.tubeq.core;

import com.umitunal.tubeq.exception.CapacityExceededException;
import com.umitunal.tubeq.exception.InvalidDeletionException;
import com.umitunal.tubeq.exception.InvalidTransitionException;
import com.umitunal.tubeq.exception.JobNotFoundException;
import com.umitunal.tubeq.exception.NotReservedException;
import com.umitunal.tubeq.exception.TimedOutException;
import com.umitunal.tubeq.model.JobSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * A named, independently locked job queue.
 *
 * <p>Jobs are served lowest priority value first, oldest first among equal priorities. A
 * reserved job belongs to the consumer that reserved it until that consumer deletes, releases
 * or buries it, or until its time-to-run runs out.
 *
 * @param <T> the type of job payload
 */
public interface Tube<T> {

    String getName();

    /**
     * Put a job into the tube.
     *
     * @param priority lower values are reserved first
     * @param delaySeconds seconds the job stays delayed before it becomes ready; 0 for ready now
     * @param ttrSeconds seconds a consumer may hold the job once reserved; 0 is raised to 1
     * @param payload the job body
     * @return the id of the new job
     * @throws CapacityExceededException if the tube already holds its maximum number of jobs
     */
    String put(long priority, long delaySeconds, long ttrSeconds, T payload) throws CapacityExceededException;

    /**
     * Put a job that is ready at once, with the tube's default time-to-run.
     */
    String put(long priority, T payload) throws CapacityExceededException;

    /**
     * Reserve the next ready job, blocking until one is available.
     *
     * @param consumerId identity of the reserving consumer
     */
    JobSnapshot<T> reserve(String consumerId) throws InterruptedException;

    /**
     * Reserve the next ready job, blocking for at most {@code timeout}.
     * A zero timeout returns immediately.
     *
     * @throws TimedOutException if no job was delivered in time
     */
    JobSnapshot<T> reserve(String consumerId, Duration timeout) throws TimedOutException, InterruptedException;

    /**
     * Return a reserved job to the ready state, or to the delayed state when {@code delaySeconds > 0}.
     */
    void release(String consumerId, String jobId, long priority, long delaySeconds)
            throws JobNotFoundException, NotReservedException;

    /**
     * Park a reserved job until it is kicked.
     *
     * @param reason free-form text kept with the job, may be null
     */
    void bury(String consumerId, String jobId, long priority, String reason)
            throws JobNotFoundException, NotReservedException;

    /**
     * Move up to {@code bound} buried jobs, oldest first, back to ready. When nothing is
     * buried, delayed jobs are kicked instead, soonest first.
     *
     * @return the number of jobs kicked
     */
    int kick(int bound);

    /**
     * Move a single buried or delayed job to ready.
     *
     * @throws InvalidTransitionException if the job is ready or reserved
     */
    void kickJob(String jobId) throws JobNotFoundException, InvalidTransitionException;

    /**
     * Remove a job. Reserved jobs may only be deleted by their consumer.
     *
     * @throws InvalidDeletionException if the job is ready or delayed and the tube does not
     *         allow direct deletes
     */
    void delete(String consumerId, String jobId)
            throws JobNotFoundException, NotReservedException, InvalidDeletionException;

    /**
     * Restart the time-to-run window of a job the consumer holds.
     */
    void touch(String consumerId, String jobId) throws JobNotFoundException, NotReservedException;

    Optional<JobSnapshot<T>> peek(String jobId);

    Optional<JobSnapshot<T>> peekReady();

    Optional<JobSnapshot<T>> peekDelayed();

    Optional<JobSnapshot<T>> peekBuried();

    TubeMetrics getMetrics();
}
