package com.junctionvision.core.signal;

import java.time.Instant;
import java.util.Objects;

/** Интервал красного сигнала, границы включительно. */
public record RedInterval(Instant start, Instant end) {

    public RedInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end < start: " + start + " .. " + end);
        }
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
