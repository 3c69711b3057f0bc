package com.junctionvision.core.detection;

/**
 * Прямоугольник трекера в координатах кадра: (x1, y1) - левый верхний угол, (x2, y2) - правый нижний.
 */
public record BoundingBox(int x1, int y1, int x2, int y2) {

    public BoundingBox {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException("Invalid box: " + x1 + "," + y1 + "," + x2 + "," + y2);
        }
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    /** Нижний центр рамки: у стоп-линии он устойчивее геометрического центра. */
    public Centroid centroid() {
        return new Centroid(Math.floorDiv(x1 + x2, 2), y2);
    }
}
