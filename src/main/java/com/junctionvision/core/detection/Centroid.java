package com.junctionvision.core.detection;

public record Centroid(int x, int y) {
}
