package com.junctionvision.core.evidence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ограниченный буфер последних отрисованных кадров, ключ - индекс кадра.
 * При переполнении вытесняется кадр с наименьшим индексом.
 * Клип может оказаться короче запрошенного: вытесненные кадры просто отсутствуют.
 *
 * @param <F> тип кадра (в конвейере - BufferedImage)
 */
public final class EvidenceWindow<F> {

    public record Entry<F>(long frameIndex, F frame, Instant timestamp) {}

    private final int capacity;
    private final NavigableMap<Long, Entry<F>> frames = new TreeMap<>();

    public EvidenceWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /** Ёмкость на bufferSeconds секунд при данном fps (не меньше одного кадра). */
    public static <F> EvidenceWindow<F> forDuration(double fps, int bufferSeconds) {
        return new EvidenceWindow<>(Math.max(1, (int) (fps * bufferSeconds)));
    }

    public void push(long frameIndex, F frame, Instant timestamp) {
        frames.put(frameIndex, new Entry<>(frameIndex, frame, timestamp));
        while (frames.size() > capacity) {
            frames.pollFirstEntry();
        }
    }

    /** Кадры с индексами в [center - half, center + half] по возрастанию индекса. */
    public List<F> extractClip(long centerFrameIndex, long halfWindowFrames) {
        long half = Math.max(0, halfWindowFrames);
        long lo = Math.max(0, centerFrameIndex - half);
        long hi = centerFrameIndex + half;
        List<F> out = new ArrayList<>();
        for (Map.Entry<Long, Entry<F>> e : frames.subMap(lo, true, hi, true).entrySet()) {
            out.add(e.getValue().frame());
        }
        return out;
    }

    public int size() {
        return frames.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Наименьший удерживаемый индекс или -1, если буфер пуст. */
    public long oldestIndex() {
        return frames.isEmpty() ? -1 : frames.firstKey();
    }

    public long newestIndex() {
        return frames.isEmpty() ? -1 : frames.lastKey();
    }
}
