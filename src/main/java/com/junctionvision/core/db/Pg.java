package com.junctionvision.core.db;

import com.junctionvision.app.Config;
import com.junctionvision.core.pipeline.ViolationRecord;
import com.junctionvision.core.profile.ProfileAggregate;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.*;
import java.time.*;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;


public final class Pg {
    private static final Logger log = LoggerFactory.getLogger(Pg.class);
    private static HikariDataSource ds;

    private Pg(){}

    public static synchronized void init(Config.Db db) {
        if (ds != null) return;
        if (db == null || db.url() == null || db.url().isBlank()) {
            throw new IllegalStateException("db.url is not configured");
        }
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(db.url());
        hc.setUsername(db.user());
        hc.setPassword(db.pass());
        hc.setMaximumPoolSize(5);
        hc.setMinimumIdle(1);
        hc.setPoolName("jv-pool");
        // быстрые таймауты и health-check
        hc.setConnectionTimeout(5000);
        hc.setValidationTimeout(3000);
        hc.setIdleTimeout(300000);
        hc.setMaxLifetime(1800000);
        hc.setConnectionTestQuery("SELECT 1");
        HikariDataSource pool = new HikariDataSource(hc);
        log.info("Pg: pool started url={}", db.url());

        // Flyway migrations (classpath:db/migration)
        try {
            Flyway fw = Flyway.configure()
                    .dataSource(pool)
                    .locations("classpath:db/migration")
                    .baselineOnMigrate(true)
                    .load();
            fw.migrate();
        } catch (RuntimeException e) {
            pool.close();
            throw e;
        }
        ds = pool;
        log.info("Pg: flyway migrate done");
    }

    public static synchronized boolean isReady() {
        return ds != null;
    }

    public static Connection get() throws SQLException {
        if (ds == null) throw new IllegalStateException("database is not available (Pg.init failed or was not called)");
        return ds.getConnection();
    }

    public static synchronized void close() {
        if (ds != null) {
            ds.close();
            ds = null;
            log.info("Pg: pool closed");
        }
    }

    /** Вставить нарушение, вернуть id строки. */
    public static int insertViolation(ViolationRecord r) {
        final String sql = """
                INSERT INTO violations(violation_uid, vehicle_plate, ts, location_id,
                                       video_clip_path, image_path, violation_type,
                                       fine_amount, ocr_confidence)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;
        try (var c = get();
             var ps = c.prepareStatement(sql)) {
            ps.setString(1, r.violationId());
            ps.setString(2, r.vehiclePlate());
            ps.setObject(3, OffsetDateTime.ofInstant(r.timestamp(), ZoneOffset.UTC));
            ps.setString(4, r.locationId());
            ps.setString(5, r.videoClipPath());
            ps.setString(6, r.imagePath());
            ps.setString(7, ViolationRecord.VIOLATION_TYPE);
            ps.setBigDecimal(8, BigDecimal.valueOf(r.fineAmount()).setScale(2, RoundingMode.HALF_EVEN));
            ps.setDouble(9, r.ocrConfidence());
            try (var rs = ps.executeQuery()) {
                if (rs.next()) return rs.getInt(1);
            }
            throw new RuntimeException("insertViolation returned no id for " + r.violationId());
        } catch (SQLException e) {
            throw new RuntimeException("insertViolation failed for " + r.violationId()
                    + " plate=" + r.vehiclePlate() + " sqlstate=" + e.getSQLState(), e);
        }
    }

    public static Optional<ProfileAggregate> findProfile(String plate) {
        final String sql = """
                SELECT vehicle_plate, total_violations, last_violation_ts, points, risk_score, history
                FROM driver_profiles
                WHERE vehicle_plate = ?
                """;
        try (Connection c = get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, plate);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(profileRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("findProfile failed for " + plate + " sqlstate=" + e.getSQLState(), e);
        }
    }

    /**
     * Создать или обновить профиль одним оператором: блокировка строки в ON CONFLICT
     * сериализует параллельные обновления одного номера.
     */
    public static ProfileAggregate upsertProfile(String plate, String violationId, Instant ts) {
        final String sql = """
                INSERT INTO driver_profiles(vehicle_plate, total_violations, last_violation_ts,
                                            points, risk_score, history)
                VALUES (?, 1, ?, ?, ?, ARRAY[?::text])
                ON CONFLICT(vehicle_plate) DO UPDATE
                  SET total_violations  = driver_profiles.total_violations + 1,
                      last_violation_ts = EXCLUDED.last_violation_ts,
                      points            = driver_profiles.points + ?,
                      risk_score        = LEAST(?, driver_profiles.risk_score * ?),
                      history           = array_append(COALESCE(driver_profiles.history, ARRAY[]::text[]), ?::text)
                RETURNING vehicle_plate, total_violations, last_violation_ts, points, risk_score, history
                """;
        try (Connection c = get();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, plate);
            ps.setObject(2, OffsetDateTime.ofInstant(ts, ZoneOffset.UTC));
            ps.setInt(3, ProfileAggregate.POINTS_PER_VIOLATION);
            ps.setDouble(4, ProfileAggregate.INITIAL_RISK);
            ps.setString(5, violationId);
            ps.setInt(6, ProfileAggregate.POINTS_PER_VIOLATION);
            ps.setDouble(7, ProfileAggregate.MAX_RISK);
            ps.setDouble(8, ProfileAggregate.RISK_GROWTH);
            ps.setString(9, violationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return profileRow(rs);
            }
            throw new RuntimeException("upsertProfile returned no row for " + plate);
        } catch (SQLException e) {
            throw new RuntimeException("upsertProfile failed for " + plate + " violation=" + violationId
                    + " sqlstate=" + e.getSQLState(), e);
        }
    }

    private static ProfileAggregate profileRow(ResultSet rs) throws SQLException {
        OffsetDateTime last = rs.getObject(3, OffsetDateTime.class);
        Array arr = rs.getArray(6);
        List<String> history = arr == null ? List.of() : Arrays.asList((String[]) arr.getArray());
        return new ProfileAggregate(
                rs.getString(1),
                rs.getInt(2),
                last == null ? null : last.toInstant(),
                rs.getInt(4),
                rs.getDouble(5),
                history);
    }
}
