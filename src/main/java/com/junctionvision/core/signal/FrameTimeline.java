package com.junctionvision.core.signal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Время кадра = начало видео + frameIndex / fps.
 * Красный, если включён forceRed или время попадает в любой интервал.
 */
public final class FrameTimeline {

    private final Instant videoStart;
    private final double fps;
    private final List<RedInterval> intervals;
    private final boolean forceRed;

    public FrameTimeline(Instant videoStart, double fps, List<RedInterval> intervals, boolean forceRed) {
        if (!(fps > 0)) {
            throw new IllegalArgumentException("fps must be > 0, got " + fps);
        }
        this.videoStart = Objects.requireNonNull(videoStart, "videoStart");
        this.fps = fps;
        this.intervals = intervals == null ? List.of() : List.copyOf(intervals);
        this.forceRed = forceRed;
    }

    public Instant timestampAt(long frameIndex) {
        long nanos = Math.round(frameIndex / fps * 1_000_000_000L);
        return videoStart.plus(Duration.ofNanos(nanos));
    }

    public boolean isRed(Instant t) {
        if (forceRed) return true;
        for (RedInterval iv : intervals) {
            if (iv.contains(t)) return true;
        }
        return false;
    }

    public boolean isRedAt(long frameIndex) {
        return isRed(timestampAt(frameIndex));
    }

    public double fps() {
        return fps;
    }
}
