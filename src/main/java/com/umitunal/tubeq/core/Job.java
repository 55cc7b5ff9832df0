package com.umitunal.tubeq.core;

/**
 * Read-only view of a job held by a tube.
 *
 * @param <T> the type of the job payload
 */
public interface Job<T> {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the name of the tube holding this job.
     */
    String getTube();

    /**
     * Gets the priority. Lower values are served first.
     */
    long getPriority();

    /**
     * Gets the delay in seconds applied when the job last entered the delayed state.
     */
    long getDelaySeconds();

    /**
     * Gets the time-to-run in seconds a consumer may hold the job once reserved.
     */
    long getTtrSeconds();

    /**
     * Gets the job payload data.
     */
    T getPayload();

    /**
     * Gets the current lifecycle state.
     */
    State getState();

    /**
     * Gets the creation time in milliseconds since epoch.
     */
    long getCreatedAt();

    /**
     * Gets the consumer currently holding the reservation, or null when not reserved.
     */
    String getReservedBy();

    long getReserves();

    long getReleases();

    long getTimeouts();

    long getBuries();

    long getKicks();

    /**
     * Lifecycle states of a job.
     *
     * <pre>
     *   put with delay               release with delay
     *  ----------------> [DELAYED] <------------.
     *                        |                   |
     *                        | (time passes)     |
     *                        v     reserve       |       delete
     *   put ------------> [READY] ---------> [RESERVED] --------> gone
     *                       ^  ^                |  |
     *                       |   \  release,     |  |
     *                       |    `-timeout-----'   |
     *                       | kick                 | bury
     *                    [BURIED] <---------------'
     *                       |  delete
     *                        `--------> gone
     * </pre>
     */
    enum State {
        READY,       // Eligible for reservation
        DELAYED,     // Waiting for its delay to elapse
        RESERVED,    // Checked out by a consumer for its TTR window
        BURIED       // Parked until kicked
    }
}
