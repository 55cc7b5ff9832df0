package com.umitunal.tubeq.journal;

/**
 * Kinds of committed change a tube reports to its journal.
 */
public enum Transition {
    PUT,
    RESERVE,
    RELEASE,
    BURY,
    KICK,
    TOUCH,
    TIMEOUT,    // TTR ran out, job forced back to ready
    PROMOTE,    // Delay elapsed
    REQUEUE,    // Delivered to a consumer that had already given up
    DELETE
}
