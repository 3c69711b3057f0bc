package com.junctionvision.core.detection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Состояние одного трека в арене {@link CrossingDetector}.
 *
 * Переходы только вперёд: NOT_SEEN → TRACKING → LOGGED.
 * LOGGED - терминальное состояние: трек больше не оценивается до конца прогона,
 * история позиций ему не нужна и освобождается.
 */
public final class TrackState {

    public enum Phase { NOT_SEEN, TRACKING, LOGGED }

    /** Позиция трека на конкретном кадре. */
    public record Position(long frameIndex, Centroid centroid) {}

    private final int trackId;
    private final int capacity;
    private final Deque<Position> history;
    private Phase phase = Phase.NOT_SEEN;
    private long lastSeenFrame = -1;

    TrackState(int trackId, int capacity) {
        this.trackId = trackId;
        this.capacity = capacity;
        this.history = new ArrayDeque<>(capacity);
    }

    public int trackId() {
        return trackId;
    }

    public Phase phase() {
        return phase;
    }

    public long lastSeenFrame() {
        return lastSeenFrame;
    }

    /** Копия истории, от старых к новым. */
    public List<Position> history() {
        return List.copyOf(history);
    }

    void record(long frameIndex, Centroid centroid) {
        lastSeenFrame = frameIndex;
        if (phase == Phase.LOGGED) return;
        phase = Phase.TRACKING;
        history.addLast(new Position(frameIndex, centroid));
        // FIFO: выкидываем самую старую позицию
        while (history.size() > capacity) {
            history.removeFirst();
        }
    }

    /** Предыдущая (перед последней) позиция или null, если в истории меньше двух записей. */
    Position previous() {
        if (history.size() < 2) return null;
        var it = history.descendingIterator();
        it.next();
        return it.next();
    }

    /** @return true, если именно этот вызов перевёл трек в LOGGED. */
    boolean markLogged() {
        if (phase == Phase.LOGGED) return false;
        phase = Phase.LOGGED;
        history.clear();
        return true;
    }
}
