package com.umitunal.tubeq.config;

/**
 * Per-tube limits and policy switches.
 */
public class TubeConfig {
    private final int maxJobs;
    private final boolean allowDirectDelete;
    private final long defaultTtrSeconds;

    private TubeConfig(Builder builder) {
        this.maxJobs = builder.maxJobs;
        this.allowDirectDelete = builder.allowDirectDelete;
        this.defaultTtrSeconds = builder.defaultTtrSeconds;
    }

    public int getMaxJobs() { return maxJobs; }
    public boolean isAllowDirectDelete() { return allowDirectDelete; }
    public long getDefaultTtrSeconds() { return defaultTtrSeconds; }

    public static TubeConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int maxJobs = Integer.MAX_VALUE;
        private boolean allowDirectDelete = false;
        private long defaultTtrSeconds = 60;

        private Builder() {
        }

        /**
         * Maximum number of jobs the tube holds across all states.
         * Default: unlimited
         */
        public Builder withMaxJobs(int maxJobs) {
            if (maxJobs <= 0) {
                throw new IllegalArgumentException("maxJobs must be positive: " + maxJobs);
            }
            this.maxJobs = maxJobs;
            return this;
        }

        /**
         * Allow deleting ready and delayed jobs without reserving them first,
         * as the beanstalkd protocol does.
         * Default: false
         */
        public Builder withDirectDelete(boolean enable) {
            this.allowDirectDelete = enable;
            return this;
        }

        /**
         * Time-to-run used by producers that do not pick one.
         * Default: 60 seconds
         */
        public Builder withDefaultTtr(long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("ttr must not be negative: " + seconds);
            }
            this.defaultTtrSeconds = seconds;
            return this;
        }

        public TubeConfig build() {
            return new TubeConfig(this);
        }
    }
}
