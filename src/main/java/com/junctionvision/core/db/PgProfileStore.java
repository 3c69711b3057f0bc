package com.junctionvision.core.db;

import com.junctionvision.core.profile.ProfileAggregate;
import com.junctionvision.core.profile.ProfileStore;
import com.junctionvision.core.profile.ProfileStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/** Профили в PostgreSQL (таблица driver_profiles). Требует {@link Pg#init}. */
public final class PgProfileStore implements ProfileStore {
    private static final Logger log = LoggerFactory.getLogger(PgProfileStore.class);

    private final Clock clock;

    public PgProfileStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ProfileAggregate> get(String plate) {
        try {
            return Pg.findProfile(plate);
        } catch (RuntimeException e) {
            throw new ProfileStoreException("profile lookup failed for " + plate, e);
        }
    }

    @Override
    public ProfileAggregate upsert(String plate, String violationId) {
        ProfileAggregate p;
        try {
            p = Pg.upsertProfile(plate, violationId, clock.instant());
        } catch (RuntimeException e) {
            throw new ProfileStoreException("profile upsert failed for " + plate + " violation=" + violationId, e);
        }
        if (p.totalViolations() == 1) {
            log.info("New driver profile created for {}.", plate);
        } else {
            log.info("Driver profile updated for {}. Total violations: {} risk={}", plate, p.totalViolations(), p.riskScore());
        }
        return p;
    }
}
