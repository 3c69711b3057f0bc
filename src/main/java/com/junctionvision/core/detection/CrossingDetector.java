package com.junctionvision.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Детектор пересечения стоп-линии по истории позиций трека.
 *
 * Пересечение фиксируется, если свет красный, в истории ≥2 позиций,
 * предыдущая Y ≤ порога, а текущая Y > порога. Точка ровно на линии
 * считается «до линии». Это детектор фронта, а не попадания в зону:
 * трек, уже бывший за линией на прошлом кадре, повторно не сработает.
 *
 * Арена состояний хранит для каждого trackId его {@link TrackState}.
 * Запрет повторной фиксации (LOGGED) выставляет оркестратор через {@link #markLogged(int)}.
 * Не потокобезопасен: один экземпляр на один последовательный прогон.
 */
public final class CrossingDetector {
    private static final Logger log = LoggerFactory.getLogger(CrossingDetector.class);

    public static final int DEFAULT_HISTORY_SIZE = 5;

    private final int historySize;
    private final Map<Integer, TrackState> arena = new HashMap<>();

    public CrossingDetector() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public CrossingDetector(int historySize) {
        if (historySize < 2) {
            throw new IllegalArgumentException("historySize must be >= 2, got " + historySize);
        }
        this.historySize = historySize;
    }

    public void observe(int trackId, long frameIndex, Centroid centroid) {
        arena.computeIfAbsent(trackId, id -> new TrackState(id, historySize))
                .record(frameIndex, centroid);
    }

    public void observe(TrackObservation obs) {
        observe(obs.trackId(), obs.frameIndex(), obs.centroid());
    }

    /**
     * Оценка пересечения для текущей позиции. Ожидается, что текущая позиция
     * уже передана в {@link #observe}: сравнение идёт с предпоследней записью истории.
     */
    public boolean evaluate(int trackId, Centroid centroid, StopLine stopLine, boolean isRedLight) {
        if (!isRedLight) return false;
        TrackState st = arena.get(trackId);
        if (st == null || st.phase() != TrackState.Phase.TRACKING) return false;
        TrackState.Position prev = st.previous();
        if (prev == null) return false;

        double threshold = stopLine.thresholdY();
        boolean wasBeforeOrOn = prev.centroid().y() <= threshold;
        boolean pastLine = centroid.y() > threshold;
        if (wasBeforeOrOn && pastLine && log.isDebugEnabled()) {
            log.debug("crossing: track={} prevY={} curY={} thr={}",
                    trackId, prev.centroid().y(), centroid.y(), threshold);
        }
        return wasBeforeOrOn && pastLine;
    }

    public TrackState.Phase phase(int trackId) {
        TrackState st = arena.get(trackId);
        return st == null ? TrackState.Phase.NOT_SEEN : st.phase();
    }

    public boolean isLogged(int trackId) {
        return phase(trackId) == TrackState.Phase.LOGGED;
    }

    /**
     * Перевести трек в LOGGED. Возвращает true только при первом переходе -
     * вызывающий обрабатывает нарушение лишь в этом случае.
     */
    public boolean markLogged(int trackId) {
        return arena.computeIfAbsent(trackId, id -> new TrackState(id, historySize)).markLogged();
    }

    /** Снимок состояния трека или null, если трек ещё не встречался. */
    public TrackState state(int trackId) {
        return arena.get(trackId);
    }

    /**
     * Освободить истории треков, не встречавшихся дольше staleFrames кадров.
     * Отметки LOGGED сохраняются до конца прогона.
     */
    public int releaseStale(long currentFrame, long staleFrames) {
        int released = 0;
        Iterator<TrackState> it = arena.values().iterator();
        while (it.hasNext()) {
            TrackState st = it.next();
            if (st.phase() == TrackState.Phase.TRACKING && currentFrame - st.lastSeenFrame() > staleFrames) {
                it.remove();
                released++;
            }
        }
        if (released > 0) log.debug("released {} stale tracks at frame {}", released, currentFrame);
        return released;
    }

    public int trackCount() {
        return arena.size();
    }
}
