package com.my.timesheet.adapter.in.idempotency;

import com.my.timesheet.config.AppConfig;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    public InMemoryIdempotencyStore(AppConfig appConfig) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), Clock.systemUTC());
    }

    InMemoryIdempotencyStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public boolean isProcessed(String key) {
        evictExpired();
        return processed.containsKey(key);
    }

    @Override
    public void markProcessed(String key) {
        evictExpired();
        processed.put(key, clock.instant());
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        processed.values().removeIf(markedAt -> markedAt.isBefore(cutoff));
    }
}
