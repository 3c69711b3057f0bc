package com.junctionvision.core.tracking;

import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.Centroid;
import com.junctionvision.core.detection.TrackedBox;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Присвоение устойчивых id рамкам: жадное сопоставление по ближайшему центру.
 * Пара (трек, рамка) принимается, если расстояние ≤ maxDistance.
 * Трек живёт maxMissedFrames кадров без совпадений; новые id только растут и не переиспользуются.
 */
public final class CentroidAssociator {

    private static final class Slot {
        final int id;
        Centroid last;
        int missed;

        Slot(int id, Centroid last) {
            this.id = id;
            this.last = last;
        }
    }

    private record Pair(Slot slot, int boxIdx, long dist2) {}

    private final int maxDistance;
    private final int maxMissedFrames;
    private final Map<Integer, Slot> active = new LinkedHashMap<>();
    private int nextId = 1;

    public CentroidAssociator(int maxDistance, int maxMissedFrames) {
        this.maxDistance = Math.max(1, maxDistance);
        this.maxMissedFrames = Math.max(0, maxMissedFrames);
    }

    public List<TrackedBox> assign(List<BoundingBox> boxes) {
        List<Pair> pairs = new ArrayList<>();
        long max2 = (long) maxDistance * maxDistance;
        for (Slot s : active.values()) {
            for (int i = 0; i < boxes.size(); i++) {
                long d2 = dist2(s.last, boxes.get(i).centroid());
                if (d2 <= max2) pairs.add(new Pair(s, i, d2));
            }
        }
        pairs.sort(Comparator.comparingLong(Pair::dist2));

        TrackedBox[] out = new TrackedBox[boxes.size()];
        List<Slot> matched = new ArrayList<>();
        for (Pair p : pairs) {
            if (out[p.boxIdx()] != null || matched.contains(p.slot())) continue;
            BoundingBox b = boxes.get(p.boxIdx());
            p.slot().last = b.centroid();
            p.slot().missed = 0;
            matched.add(p.slot());
            out[p.boxIdx()] = new TrackedBox(p.slot().id, b);
        }

        // несопоставленные треки стареют
        Iterator<Slot> it = active.values().iterator();
        while (it.hasNext()) {
            Slot s = it.next();
            if (!matched.contains(s) && ++s.missed > maxMissedFrames) it.remove();
        }
        // несопоставленные рамки - новые треки
        for (int i = 0; i < out.length; i++) {
            if (out[i] != null) continue;
            BoundingBox b = boxes.get(i);
            Slot s = new Slot(nextId++, b.centroid());
            active.put(s.id, s);
            out[i] = new TrackedBox(s.id, b);
        }
        return List.of(out);
    }

    public int activeCount() {
        return active.size();
    }

    private static long dist2(Centroid a, Centroid b) {
        long dx = a.x() - b.x(), dy = a.y() - b.y();
        return dx * dx + dy * dy;
    }
}
