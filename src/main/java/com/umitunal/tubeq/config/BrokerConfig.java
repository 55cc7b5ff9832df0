package com.umitunal.tubeq.config;

import com.umitunal.tubeq.core.IdGenerator;
import com.umitunal.tubeq.core.TimeSource;

import java.time.Duration;

/**
 * Settings shared by every tube a broker owns.
 */
public class BrokerConfig {
    private final Duration sweepInterval;
    private final TubeConfig defaultTubeConfig;
    private final TimeSource timeSource;
    private final IdGenerator idGenerator;

    private BrokerConfig(Builder builder) {
        this.sweepInterval = builder.sweepInterval;
        this.defaultTubeConfig = builder.defaultTubeConfig;
        this.timeSource = builder.timeSource;
        this.idGenerator = builder.idGenerator;
    }

    public Duration getSweepInterval() { return sweepInterval; }
    public TubeConfig getDefaultTubeConfig() { return defaultTubeConfig; }
    public TimeSource getTimeSource() { return timeSource; }
    public IdGenerator getIdGenerator() { return idGenerator; }

    public static BrokerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Duration sweepInterval = Duration.ofSeconds(1);
        private TubeConfig defaultTubeConfig = TubeConfig.defaults();
        private TimeSource timeSource = TimeSource.SYSTEM;
        private IdGenerator idGenerator = IdGenerator.sequential();

        private Builder() {
        }

        /**
         * How often the expiry sweeper visits every tube.
         * Default: 1 second
         */
        public Builder withSweepInterval(Duration interval) {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("sweep interval must be positive: " + interval);
            }
            this.sweepInterval = interval;
            return this;
        }

        /**
         * Config applied to tubes created on first use.
         */
        public Builder withDefaultTubeConfig(TubeConfig config) {
            this.defaultTubeConfig = config;
            return this;
        }

        public Builder withTimeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        /**
         * Default: sequential integer ids
         */
        public Builder withIdGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(this);
        }
    }
}
