package com.umitunal.tubeq.engine;

import com.umitunal.tubeq.config.BrokerConfig;
import com.umitunal.tubeq.config.TubeConfig;
import com.umitunal.tubeq.core.Tube;
import com.umitunal.tubeq.core.TubeMetrics;
import com.umitunal.tubeq.journal.JobJournal;
import com.umitunal.tubeq.model.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns a set of named tubes that share one clock, one id generator, one journal and one
 * expiry sweeper. Tubes are created on first use, as with beanstalkd's {@code use} and
 * {@code watch}.
 *
 * @param <T> the type of job payload
 */
public class TubeBroker<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TubeBroker.class);

    public static final String DEFAULT_TUBE = "default";

    private final BrokerConfig config;
    private final JobJournal<T> journal;
    private final ConcurrentMap<String, PriorityTube<T>> tubes = new ConcurrentHashMap<>();
    private final ExpirySweeper sweeper;

    public TubeBroker(BrokerConfig config) {
        this(config, JobJournal.noop());
    }

    public TubeBroker(BrokerConfig config, JobJournal<T> journal) {
        this.config = config;
        this.journal = journal;
        this.sweeper = new ExpirySweeper(tubes.values(), config.getSweepInterval());
    }

    /**
     * Start the background expiry sweeper.
     */
    public void start() {
        sweeper.start();
        log.info("Broker started with {} tubes", tubes.size());
    }

    public Tube<T> defaultTube() {
        return tube(DEFAULT_TUBE);
    }

    /**
     * Get a tube, creating it with the broker's default tube config if it does not exist.
     */
    public Tube<T> tube(String name) {
        return tubes.computeIfAbsent(name, n -> newTube(n, config.getDefaultTubeConfig()));
    }

    /**
     * Create a tube with its own config.
     *
     * @throws IllegalStateException if a tube with that name already exists
     */
    public Tube<T> createTube(String name, TubeConfig tubeConfig) {
        PriorityTube<T> created = newTube(name, tubeConfig);
        PriorityTube<T> existing = tubes.putIfAbsent(name, created);
        if (existing != null) {
            throw new IllegalStateException("Tube already exists: " + name);
        }
        return created;
    }

    public Optional<Tube<T>> findTube(String name) {
        return Optional.<Tube<T>>ofNullable(tubes.get(name));
    }

    /**
     * Names of all tubes, sorted.
     */
    public Set<String> tubeNames() {
        return new TreeSet<>(tubes.keySet());
    }

    /**
     * Look a job up by id across all tubes.
     */
    public Optional<JobSnapshot<T>> peek(String jobId) {
        for (PriorityTube<T> tube : tubes.values()) {
            Optional<JobSnapshot<T>> job = tube.peek(jobId);
            if (job.isPresent()) {
                return job;
            }
        }
        return Optional.empty();
    }

    public List<TubeMetrics> getMetrics() {
        List<TubeMetrics> metrics = new ArrayList<>();
        for (String name : tubeNames()) {
            metrics.add(tubes.get(name).getMetrics());
        }
        return metrics;
    }

    /**
     * Run one expiry pass over every tube on the calling thread.
     *
     * @return the number of jobs moved to ready
     */
    public int sweep() {
        return sweeper.sweepOnce();
    }

    public ExpirySweeper getSweeper() {
        return sweeper;
    }

    /**
     * Stop the sweeper and close the journal.
     */
    @Override
    public void close() {
        sweeper.stop();
        journal.close();
        log.info("Broker closed");
    }

    private PriorityTube<T> newTube(String name, TubeConfig tubeConfig) {
        PriorityTube<T> tube = new PriorityTube<>(name, tubeConfig, config.getTimeSource(), config.getIdGenerator(), journal);
        log.info("Created tube {}", name);
        return tube;
    }
}
