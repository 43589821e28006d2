package com.github.dimitryivaniuta.wrappers.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window log: per key, the timestamps of admitted calls inside the last {@code window}.
 *
 * <p>A timestamp exactly {@code window} old has left the window. Prune, check and record happen
 * atomically per key.
 */
public final class SlidingWindowRateLimiter {

    private final int limit;
    private final long windowMillis;
    private final Clock clock;

    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    /**
     * Records a call for {@code key} if the window has room.
     *
     * @return {@link Duration#ZERO} when admitted, otherwise the time until the oldest call leaves the window
     */
    public Duration tryAcquire(String key) {
        Duration[] retryAfter = {Duration.ZERO};
        windows.compute(key, (k, timestamps) -> {
            long now = clock.millis();
            Deque<Long> log = (timestamps != null) ? timestamps : new ArrayDeque<>();
            prune(log, now);

            if (log.size() >= limit) {
                retryAfter[0] = Duration.ofMillis(log.peekFirst() + windowMillis - now);
                return log;
            }

            log.addLast(now);
            return log;
        });
        return retryAfter[0];
    }

    public int currentCount(String key) {
        int[] count = {0};
        windows.computeIfPresent(key, (k, log) -> {
            prune(log, clock.millis());
            count[0] = log.size();
            return log;
        });
        return count[0];
    }

    private void prune(Deque<Long> log, long now) {
        long windowStart = now - windowMillis;
        while (!log.isEmpty() && log.peekFirst() <= windowStart) {
            log.pollFirst();
        }
    }
}
