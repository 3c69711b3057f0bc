package com.junctionvision.core.pipeline;

import java.time.Instant;
import java.util.Objects;

/**
 * Зафиксированное нарушение - то, что уходит во внешний приёмник.
 * Неизменяемый; номер не длиннее {@link #MAX_PLATE_LENGTH}, штраф ≥ 0, уверенность в [0, 1].
 */
public record ViolationRecord(
        String violationId,
        int trackId,
        long frameIndex,
        Instant timestamp,
        String locationId,
        String vehiclePlate,
        double fineAmount,
        String imagePath,
        String videoClipPath,
        double ocrConfidence
) {
    public static final int MAX_PLATE_LENGTH = 10;
    public static final String VIOLATION_TYPE = "Red_Light_Crossing";

    public ViolationRecord {
        Objects.requireNonNull(violationId, "violationId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(vehiclePlate, "vehiclePlate");
        if (vehiclePlate.isEmpty() || vehiclePlate.length() > MAX_PLATE_LENGTH) {
            throw new IllegalArgumentException("vehiclePlate must be 1.." + MAX_PLATE_LENGTH + " chars: '" + vehiclePlate + "'");
        }
        if (fineAmount < 0) throw new IllegalArgumentException("fineAmount < 0: " + fineAmount);
        if (ocrConfidence < 0.0 || ocrConfidence > 1.0) {
            throw new IllegalArgumentException("ocrConfidence out of [0,1]: " + ocrConfidence);
        }
    }
}
