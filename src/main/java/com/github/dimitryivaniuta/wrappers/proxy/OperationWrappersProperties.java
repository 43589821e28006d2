package com.github.dimitryivaniuta.wrappers.proxy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "operation-wrappers")
public class OperationWrappersProperties {
    private boolean enabled = true;

    // threads for retry waits, timeout timers and debounce timers
    private int schedulerThreads = 2;

    // don't wrap infrastructure / JDK
    private List<String> excludePackages = List.of(
            "org.springframework",
            "jakarta",
            "java",
            "kotlin",
            "com.zaxxer"
    );

    private final Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
        // bounds caches with an expiry only; 0 or less means unbounded
        private long maximumSize = 50_000;
    }
}
