package com.junctionvision.core.detection;

public record TrackObservation(int trackId, long frameIndex, Centroid centroid, BoundingBox box) {

    public static TrackObservation of(TrackedBox tb, long frameIndex) {
        return new TrackObservation(tb.trackId(), frameIndex, tb.box().centroid(), tb.box());
    }
}
