package com.umitunal.tubeq.engine;

import com.umitunal.tubeq.config.TubeConfig;
import com.umitunal.tubeq.core.IdGenerator;
import com.umitunal.tubeq.core.Job;
import com.umitunal.tubeq.core.TimeSource;
import com.umitunal.tubeq.core.Tube;
import com.umitunal.tubeq.core.TubeMetrics;
import com.umitunal.tubeq.exception.CapacityExceededException;
import com.umitunal.tubeq.exception.InvalidDeletionException;
import com.umitunal.tubeq.exception.InvalidTransitionException;
import com.umitunal.tubeq.exception.JobNotFoundException;
import com.umitunal.tubeq.exception.NotReservedException;
import com.umitunal.tubeq.exception.TimedOutException;
import com.umitunal.tubeq.journal.JobJournal;
import com.umitunal.tubeq.journal.Transition;
import com.umitunal.tubeq.journal.TransitionEvent;
import com.umitunal.tubeq.model.JobSnapshot;
import com.umitunal.tubeq.model.WaitingConsumer;
import com.umitunal.tubeq.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * In-memory tube keeping its jobs in per-state ordered collections.
 *
 * <ul>
 *   <li>ready: by priority, then filing order</li>
 *   <li>delayed: by the time the job becomes ready, then filing order</li>
 *   <li>reserved: by the time the reservation expires, then filing order</li>
 *   <li>buried: filing order</li>
 * </ul>
 *
 * <p>A single {@link ReentrantLock} guards the collections and every job in them. Blocked
 * reserves wait on their own delivery slot, never on the lock.
 *
 * @param <T> the type of job payload
 */
public class PriorityTube<T> implements Tube<T> {
    private static final Logger log = LoggerFactory.getLogger(PriorityTube.class);

    public static final int MAX_NAME_BYTES = 200;
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9+/;.$_()][A-Za-z0-9+/;.$_()\\-]*");

    private final String name;
    private final TubeConfig config;
    private final TimeSource timeSource;
    private final IdGenerator idGenerator;
    private final JobJournal<T> journal;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReservationDispatcher<T> dispatcher;

    private final Map<String, WorkUnit<T>> jobs = new HashMap<>();
    private final TreeSet<WorkUnit<T>> ready = new TreeSet<>(
            Comparator.comparingLong((WorkUnit<T> unit) -> unit.getPriority())
                    .thenComparingLong(WorkUnit::getFilingSequence));
    private final TreeSet<WorkUnit<T>> delayed = new TreeSet<>(
            Comparator.comparingLong((WorkUnit<T> unit) -> unit.getReadyAt())
                    .thenComparingLong(WorkUnit::getFilingSequence));
    private final TreeSet<WorkUnit<T>> reserved = new TreeSet<>(
            Comparator.comparingLong((WorkUnit<T> unit) -> unit.getExpiresAt())
                    .thenComparingLong(WorkUnit::getFilingSequence));
    private final LinkedHashMap<String, WorkUnit<T>> buried = new LinkedHashMap<>();

    private long filingSequence;
    private long totalPuts;
    private long totalDeletes;
    private long totalTimeouts;

    public PriorityTube(String name) {
        this(name, TubeConfig.defaults(), TimeSource.SYSTEM, IdGenerator.sequential(), JobJournal.noop());
    }

    public PriorityTube(String name, TubeConfig config, TimeSource timeSource, IdGenerator idGenerator,
                        JobJournal<T> journal) {
        this.name = checkName(name);
        this.config = config;
        this.timeSource = timeSource;
        this.idGenerator = idGenerator;
        this.journal = journal;
        this.dispatcher = new ReservationDispatcher<>(this);
    }

    @Override
    public String getName() {
        return name;
    }

    public TubeConfig getConfig() {
        return config;
    }

    @Override
    public String put(long priority, long delaySeconds, long ttrSeconds, T payload) throws CapacityExceededException {
        lock.lock();
        try {
            if (jobs.size() >= config.getMaxJobs()) {
                throw new CapacityExceededException(name, config.getMaxJobs());
            }
            long now = now();
            WorkUnit<T> unit = new WorkUnit<>(idGenerator.nextId(), name, priority, delaySeconds, ttrSeconds, payload, now);
            jobs.put(unit.getId(), unit);
            file(unit);
            totalPuts++;
            record(Transition.PUT, unit, null, now);
            log.debug("Put job {} on tube {} as {}", unit.getId(), name, unit.getState());

            if (unit.getState() == Job.State.READY) {
                dispatcher.dispatch(now);
            }
            return unit.getId();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String put(long priority, T payload) throws CapacityExceededException {
        return put(priority, 0, config.getDefaultTtrSeconds(), payload);
    }

    @Override
    public JobSnapshot<T> reserve(String consumerId) throws InterruptedException {
        try {
            return reserve(consumerId, null);
        } catch (TimedOutException e) {
            throw new IllegalStateException("Reserve without a deadline timed out", e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Due delayed jobs and expired reservations are swept first, so a reserve never misses a
     * job only because the sweeper has not run yet. A null timeout waits forever.
     */
    @Override
    public JobSnapshot<T> reserve(String consumerId, Duration timeout) throws TimedOutException, InterruptedException {
        Objects.requireNonNull(consumerId, "consumerId");
        WaitingConsumer<T> handle;

        lock.lock();
        try {
            long now = now();
            sweep(now);

            JobSnapshot<T> job = reserveNext(consumerId, now);
            if (job != null) {
                return job;
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new TimedOutException(name, timeout);
            }
            handle = new WaitingConsumer<>(idGenerator.nextId(), consumerId, now);
            dispatcher.enqueue(handle);
            log.debug("Consumer {} waiting on tube {} (handle {})", consumerId, name, handle.getId());
        } finally {
            lock.unlock();
        }

        return awaitDelivery(handle, timeout);
    }

    @Override
    public void release(String consumerId, String jobId, long priority, long delaySeconds)
            throws JobNotFoundException, NotReservedException {
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + delaySeconds);
        }
        lock.lock();
        try {
            long now = now();
            WorkUnit<T> unit = requireReservedBy(jobId, consumerId);
            moveChecked(unit, u -> u.release(priority, delaySeconds, now));
            record(Transition.RELEASE, unit, consumerId, now);
            log.debug("Consumer {} released job {} on tube {} as {}", consumerId, jobId, name, unit.getState());

            if (unit.getState() == Job.State.READY) {
                dispatcher.dispatch(now);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void bury(String consumerId, String jobId, long priority, String reason)
            throws JobNotFoundException, NotReservedException {
        lock.lock();
        try {
            long now = now();
            WorkUnit<T> unit = requireReservedBy(jobId, consumerId);
            moveChecked(unit, u -> u.bury(priority, reason, now));
            record(Transition.BURY, unit, consumerId, now);
            log.debug("Consumer {} buried job {} on tube {}", consumerId, jobId, name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int kick(int bound) {
        if (bound <= 0) {
            return 0;
        }
        lock.lock();
        try {
            long now = now();
            List<WorkUnit<T>> targets = new ArrayList<>(Math.min(bound, jobs.size()));
            Iterator<WorkUnit<T>> source = buried.isEmpty()
                    ? delayed.iterator()
                    : buried.values().iterator();
            while (source.hasNext() && targets.size() < bound) {
                targets.add(source.next());
            }

            for (WorkUnit<T> unit : targets) {
                moveChecked(unit, u -> u.kick(now));
                record(Transition.KICK, unit, null, now);
            }
            if (!targets.isEmpty()) {
                log.debug("Kicked {} jobs on tube {}", targets.size(), name);
                dispatcher.dispatch(now);
            }
            return targets.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void kickJob(String jobId) throws JobNotFoundException, InvalidTransitionException {
        lock.lock();
        try {
            long now = now();
            WorkUnit<T> unit = require(jobId);
            move(unit, u -> u.kick(now));
            record(Transition.KICK, unit, null, now);
            dispatcher.dispatch(now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String consumerId, String jobId)
            throws JobNotFoundException, NotReservedException, InvalidDeletionException {
        lock.lock();
        try {
            long now = now();
            WorkUnit<T> unit = require(jobId);
            switch (unit.getState()) {
                case RESERVED -> {
                    if (!Objects.equals(consumerId, unit.getReservedBy())) {
                        throw new NotReservedException(jobId, consumerId);
                    }
                }
                case READY, DELAYED -> {
                    if (!config.isAllowDirectDelete()) {
                        throw new InvalidDeletionException(jobId, unit.getState());
                    }
                }
                case BURIED -> {
                    // Always deletable
                }
            }
            unfile(unit);
            jobs.remove(jobId);
            totalDeletes++;
            record(Transition.DELETE, unit, consumerId, now);
            log.debug("Deleted job {} from tube {}", jobId, name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void touch(String consumerId, String jobId) throws JobNotFoundException, NotReservedException {
        lock.lock();
        try {
            long now = now();
            WorkUnit<T> unit = requireReservedBy(jobId, consumerId);
            moveChecked(unit, u -> u.touch(now));
            record(Transition.TOUCH, unit, consumerId, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobSnapshot<T>> peek(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId)).map(unit -> unit.snapshot(now()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobSnapshot<T>> peekReady() {
        lock.lock();
        try {
            return ready.isEmpty() ? Optional.empty() : Optional.of(ready.first().snapshot(now()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobSnapshot<T>> peekDelayed() {
        lock.lock();
        try {
            return delayed.isEmpty() ? Optional.empty() : Optional.of(delayed.first().snapshot(now()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobSnapshot<T>> peekBuried() {
        lock.lock();
        try {
            return buried.values().stream().findFirst().map(unit -> unit.snapshot(now()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TubeMetrics getMetrics() {
        lock.lock();
        try {
            return new TubeMetrics(name, ready.size(), delayed.size(), reserved.size(), buried.size(),
                    dispatcher.waitingCount(), totalPuts, totalDeletes, totalTimeouts);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Promotes delayed jobs whose delay has elapsed and times out reservations whose
     * time-to-run has run out, then serves waiting consumers.
     *
     * @return the number of jobs moved to ready
     */
    public int sweep() {
        lock.lock();
        try {
            return sweep(now());
        } finally {
            lock.unlock();
        }
    }

    private int sweep(long now) {
        int moved = 0;

        List<WorkUnit<T>> skipped = new ArrayList<>();
        while (!delayed.isEmpty() && delayed.first().getReadyAt() <= now) {
            WorkUnit<T> unit = delayed.pollFirst();
            if (!jobs.containsKey(unit.getId())) {
                log.warn("Dropping unknown job {} from delayed set of tube {}", unit.getId(), name);
                continue;
            }
            try {
                unit.promote(now);
            } catch (InvalidTransitionException e) {
                log.warn("Skipping job {} on tube {}: {}", unit.getId(), name, e.getMessage());
                skipped.add(unit);
                continue;
            }
            file(unit);
            record(Transition.PROMOTE, unit, null, now);
            moved++;
        }
        delayed.addAll(skipped);

        skipped.clear();
        while (!reserved.isEmpty() && reserved.first().getExpiresAt() <= now) {
            WorkUnit<T> unit = reserved.pollFirst();
            if (!jobs.containsKey(unit.getId())) {
                log.warn("Dropping unknown job {} from reserved set of tube {}", unit.getId(), name);
                continue;
            }
            String consumerId = unit.getReservedBy();
            try {
                unit.timeOut(now);
            } catch (InvalidTransitionException e) {
                log.warn("Skipping job {} on tube {}: {}", unit.getId(), name, e.getMessage());
                skipped.add(unit);
                continue;
            }
            file(unit);
            totalTimeouts++;
            record(Transition.TIMEOUT, unit, consumerId, now);
            log.debug("Reservation of job {} by {} on tube {} timed out", unit.getId(), consumerId, name);
            moved++;
        }
        reserved.addAll(skipped);

        if (moved > 0) {
            dispatcher.dispatch(now);
        }
        return moved;
    }

    // ========== Dispatcher support, lock held ==========

    boolean hasReady() {
        return !ready.isEmpty();
    }

    /**
     * Reserves the first ready job for {@code consumerId}.
     *
     * @return the reserved job, or null when nothing is ready
     */
    JobSnapshot<T> reserveNext(String consumerId, long now) {
        if (ready.isEmpty()) {
            return null;
        }
        WorkUnit<T> unit = ready.first();
        moveChecked(unit, u -> u.reserve(consumerId, now));
        record(Transition.RESERVE, unit, consumerId, now);
        log.debug("Consumer {} reserved job {} on tube {}", consumerId, unit.getId(), name);
        return unit.snapshot(now);
    }

    /**
     * Sends a job reserved for a consumer that never received it back to ready.
     * Not counted as a release.
     */
    private void returnToReady(JobSnapshot<T> job, long now) {
        WorkUnit<T> unit = jobs.get(job.getId());
        if (unit == null || unit.getState() != Job.State.RESERVED
                || !Objects.equals(unit.getReservedBy(), job.getReservedBy())) {
            log.warn("Job {} on tube {} changed hands before it could be returned", job.getId(), name);
            return;
        }
        moveChecked(unit, u -> u.abandon(now));
        record(Transition.REQUEUE, unit, job.getReservedBy(), now);
        log.debug("Returned undelivered job {} to ready on tube {}", job.getId(), name);
    }

    // ========== Internals ==========

    /**
     * Waits on a registered handle. When the wait ends without a job the handle is withdrawn
     * under the lock; a job that reached the handle anyway is returned on timeout, and sent
     * back to ready on any other failure.
     */
    JobSnapshot<T> awaitDelivery(WaitingConsumer<T> handle, Duration timeout)
            throws TimedOutException, InterruptedException {
        try {
            return timeout == null ? handle.await() : handle.await(timeout);
        } catch (TimeoutException e) {
            lock.lock();
            try {
                if (dispatcher.cancel(handle)) {
                    log.debug("Consumer {} timed out on tube {}", handle.getConsumerId(), name);
                    throw new TimedOutException(name, timeout);
                }
                // Served after the deadline passed but before we got the lock
                return handle.delivered().orElseThrow(
                        () -> new IllegalStateException("Handle " + handle.getId() + " left the queue without a job"));
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException | RuntimeException e) {
            withdraw(handle);
            throw e;
        }
    }

    /**
     * Registers a waiting handle and serves it at once if a job is ready.
     */
    void register(WaitingConsumer<T> handle) {
        lock.lock();
        try {
            dispatcher.enqueue(handle);
            dispatcher.dispatch(now());
        } finally {
            lock.unlock();
        }
    }

    private void withdraw(WaitingConsumer<T> handle) {
        lock.lock();
        try {
            if (!dispatcher.cancel(handle)) {
                long now = now();
                handle.delivered().ifPresent(job -> returnToReady(job, now));
                dispatcher.dispatch(now);
            }
        } finally {
            lock.unlock();
        }
    }

    private WorkUnit<T> require(String jobId) throws JobNotFoundException {
        WorkUnit<T> unit = jobs.get(jobId);
        if (unit == null) {
            throw new JobNotFoundException(jobId);
        }
        return unit;
    }

    private WorkUnit<T> requireReservedBy(String jobId, String consumerId)
            throws JobNotFoundException, NotReservedException {
        WorkUnit<T> unit = require(jobId);
        if (unit.getState() != Job.State.RESERVED || !Objects.equals(consumerId, unit.getReservedBy())) {
            throw new NotReservedException(jobId, consumerId);
        }
        return unit;
    }

    /**
     * Takes the unit out of its collection, applies {@code change}, and files it under its
     * new state. On failure the unit goes back where it was, unchanged.
     */
    private void move(WorkUnit<T> unit, UnitChange<T> change) throws InvalidTransitionException {
        unfile(unit);
        try {
            change.apply(unit);
        } catch (InvalidTransitionException e) {
            place(unit);
            throw e;
        }
        file(unit);
    }

    /**
     * {@link #move} for changes whose legality the caller has already established.
     */
    private void moveChecked(WorkUnit<T> unit, UnitChange<T> change) {
        try {
            move(unit, change);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException("Tube " + name + " holds job " + unit.getId()
                    + " in an inconsistent state", e);
        }
    }

    private void file(WorkUnit<T> unit) {
        unit.setFilingSequence(++filingSequence);
        place(unit);
    }

    private void place(WorkUnit<T> unit) {
        switch (unit.getState()) {
            case READY -> ready.add(unit);
            case DELAYED -> delayed.add(unit);
            case RESERVED -> reserved.add(unit);
            case BURIED -> buried.put(unit.getId(), unit);
        }
    }

    private void unfile(WorkUnit<T> unit) {
        switch (unit.getState()) {
            case READY -> ready.remove(unit);
            case DELAYED -> delayed.remove(unit);
            case RESERVED -> reserved.remove(unit);
            case BURIED -> buried.remove(unit.getId());
        }
    }

    private void record(Transition transition, WorkUnit<T> unit, String consumerId, long now) {
        try {
            journal.append(new TransitionEvent<>(transition, unit.snapshot(now), consumerId));
        } catch (RuntimeException e) {
            log.error("Journal rejected {} of job {} on tube {}", transition, unit.getId(), name, e);
        }
    }

    private long now() {
        return timeSource.currentTimeMillis();
    }

    static String checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tube name must not be empty");
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw new IllegalArgumentException("Tube name longer than " + MAX_NAME_BYTES + " bytes: " + name);
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tube name: " + name);
        }
        return name;
    }

    @FunctionalInterface
    private interface UnitChange<T> {
        void apply(WorkUnit<T> unit) throws InvalidTransitionException;
    }

    @Override
    public String toString() {
        return "PriorityTube{" + name + "}";
    }
}
