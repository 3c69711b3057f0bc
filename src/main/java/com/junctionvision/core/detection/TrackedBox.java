package com.junctionvision.core.detection;

/** Один результат трекера на кадре: устойчивый id объекта + его рамка. */
public record TrackedBox(int trackId, BoundingBox box) {
}
