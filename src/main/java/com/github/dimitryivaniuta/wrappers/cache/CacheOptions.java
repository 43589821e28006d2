package com.github.dimitryivaniuta.wrappers.cache;

import com.github.dimitryivaniuta.wrappers.operation.KeyFunction;
import lombok.Builder;

import java.time.Duration;

/**
 * @param expiryTime entry lifetime after write; {@code null} keeps entries until invalidated
 * @param key        custom key derivation; {@code null} uses scope, name and serialized arguments
 */
@Builder
public record CacheOptions(Duration expiryTime, KeyFunction key) {

    public static CacheOptions defaults() {
        return new CacheOptions(null, null);
    }
}
