package com.junctionvision.core.detection;

/**
 * Факт пересечения стоп-линии на красный. Для одного trackId за время прогона
 * создаётся не более одного события (см. {@link TrackState}).
 */
public record CrossingEvent(int trackId, long frameIndex, Centroid centroid, BoundingBox box) {

    public static CrossingEvent of(TrackObservation obs) {
        return new CrossingEvent(obs.trackId(), obs.frameIndex(), obs.centroid(), obs.box());
    }
}
