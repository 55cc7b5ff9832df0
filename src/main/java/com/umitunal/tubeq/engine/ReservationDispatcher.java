package com.umitunal.tubeq.engine;

import com.umitunal.tubeq.model.JobSnapshot;
import com.umitunal.tubeq.model.WaitingConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Matches ready jobs to consumers blocked on reserve.
 *
 * <p>Consumers are served in arrival order and always receive the lowest-priority-value ready
 * job. A handle leaves the queue before its slot is filled, and {@link #cancel} only closes
 * handles it removed, so every queued handle is open. A consumer that finds its handle still
 * queued knows nothing was delivered to it. Every method requires the owning tube's lock.
 *
 * @param <T> the type of job payload
 */
final class ReservationDispatcher<T> {
    private static final Logger log = LoggerFactory.getLogger(ReservationDispatcher.class);

    private final PriorityTube<T> tube;
    private final Deque<WaitingConsumer<T>> waiting = new ArrayDeque<>();

    ReservationDispatcher(PriorityTube<T> tube) {
        this.tube = tube;
    }

    void enqueue(WaitingConsumer<T> handle) {
        waiting.addLast(handle);
    }

    /**
     * Withdraws a handle that has not been served yet and closes its slot.
     *
     * @return false if the handle was already served
     */
    boolean cancel(WaitingConsumer<T> handle) {
        if (waiting.remove(handle)) {
            handle.abandon();
            return true;
        }
        return false;
    }

    int waitingCount() {
        return waiting.size();
    }

    /**
     * Serves waiting consumers while there are both consumers and ready jobs.
     *
     * @return the number of jobs handed out
     */
    int dispatch(long now) {
        int delivered = 0;
        while (tube.hasReady() && !waiting.isEmpty()) {
            WaitingConsumer<T> handle = waiting.pollFirst();
            JobSnapshot<T> job = tube.reserveNext(handle.getConsumerId(), now);
            handle.deliver(job);
            delivered++;
            log.debug("Delivered job {} to waiting consumer {} on tube {}",
                    job.getId(), handle.getConsumerId(), tube.getName());
        }
        return delivered;
    }
}
