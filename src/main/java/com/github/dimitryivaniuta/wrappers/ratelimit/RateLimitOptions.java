package com.github.dimitryivaniuta.wrappers.ratelimit;

import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import lombok.Builder;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * @param limit  calls allowed per window and key
 * @param window sliding window length
 * @param key    custom bucket key; {@code null} uses {@code scope.name}
 */
@Builder
public record RateLimitOptions(int limit, Duration window, KeyFunction key) {

    public RateLimitOptions {
        Assert.isTrue(limit >= 1, "limit must be >= 1");
        Assert.notNull(window, "window must not be null");
        Assert.isTrue(!window.isNegative() && !window.isZero(), "window must be positive");
    }
}
