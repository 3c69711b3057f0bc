package com.junctionvision.core.profile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Профили в памяти процесса; атомарность на ключ - через ConcurrentHashMap.compute. */
public final class InMemoryProfileStore implements ProfileStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final ConcurrentMap<String, ProfileAggregate> profiles = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProfileStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProfileStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<ProfileAggregate> get(String plate) {
        return Optional.ofNullable(profiles.get(plate));
    }

    @Override
    public ProfileAggregate upsert(String plate, String violationId) {
        Objects.requireNonNull(plate, "plate");
        Objects.requireNonNull(violationId, "violationId");
        ProfileAggregate updated = profiles.compute(plate, (k, cur) -> cur == null
                ? ProfileAggregate.first(k, violationId, clock.instant())
                : cur.next(violationId, clock.instant()));
        if (updated.totalViolations() == 1) {
            log.info("New driver profile created for {}.", plate);
        } else {
            log.info("Driver profile updated for {}. Total violations: {}", plate, updated.totalViolations());
        }
        return updated;
    }
}
