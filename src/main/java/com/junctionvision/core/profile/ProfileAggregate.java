package com.junctionvision.core.profile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Агрегат по номеру: число нарушений, баллы, риск [1.0; 5.0] и история id нарушений.
 * Неизменяемый: каждое нарушение даёт новый экземпляр через {@link #first} / {@link #next}.
 * История только дописывается, порядок не меняется и не обрезается.
 */
public record ProfileAggregate(
        String plate,
        int totalViolations,
        Instant lastViolationTs,
        int points,
        double riskScore,
        List<String> history
) {
    public static final double INITIAL_RISK = 1.5;
    public static final int POINTS_PER_VIOLATION = 3;
    public static final double RISK_GROWTH = 1.1;
    public static final double MAX_RISK = 5.0;

    public ProfileAggregate {
        Objects.requireNonNull(plate, "plate");
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Первое нарушение для номера. */
    public static ProfileAggregate first(String plate, String violationId, Instant ts) {
        return new ProfileAggregate(plate, 1, ts, POINTS_PER_VIOLATION, INITIAL_RISK, List.of(violationId));
    }

    /** Очередное нарушение: count+1, points+3, risk = min(5.0, risk*1.1), id в конец истории. */
    public ProfileAggregate next(String violationId, Instant ts) {
        List<String> h = new ArrayList<>(history.size() + 1);
        h.addAll(history);
        h.add(violationId);
        return new ProfileAggregate(
                plate,
                totalViolations + 1,
                ts,
                points + POINTS_PER_VIOLATION,
                Math.min(MAX_RISK, riskScore * RISK_GROWTH),
                h);
    }
}
