package com.github.dimitryivaniuta.wrappers.retry;

/**
 * Maps an attempt number (1 = first failure) to the wait before the next attempt.
 */
public enum RetryStrategy {

    NORMAL {
        @Override
        public long delayMillis(long backoffMillis, int attempt) {
            return backoffMillis;
        }
    },

    EXPONENTIAL {
        @Override
        public long delayMillis(long backoffMillis, int attempt) {
            int shift = Math.min(Math.max(attempt - 1, 0), 30);
            return backoffMillis * (1L << shift);
        }
    };

    public abstract long delayMillis(long backoffMillis, int attempt);
}
