package com.junctionvision.core.tracking;

import com.junctionvision.core.detection.TrackedBox;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Детектор+трекер транспорта. Id трека устойчив между кадрами для одного объекта.
 * Может бросать RuntimeException - конвейер заменит результат пустым списком.
 */
@FunctionalInterface
public interface VehicleTracker {
    List<TrackedBox> track(BufferedImage frame);
}
