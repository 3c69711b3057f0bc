package com.junctionvision.core.detection;

/**
 * Стоп-линия, заданная двумя концами.
 * Наклон линии не моделируется: граница пересечения - средняя Y концов.
 */
public record StopLine(int x1, int y1, int x2, int y2) {

    public double thresholdY() {
        return (y1 + y2) / 2.0;
    }

    /** Разбор строки вида "x1,y1,x2,y2" (пробелы допускаются). */
    public static StopLine parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Stop line must have 4 coordinates (x1,y1,x2,y2).");
        }
        String[] parts = s.split(",", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Stop line must have 4 coordinates (x1,y1,x2,y2): " + s);
        }
        int[] c = new int[4];
        for (int i = 0; i < 4; i++) {
            try {
                c[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid stop line coordinate '" + parts[i] + "' in: " + s, e);
            }
        }
        return new StopLine(c[0], c[1], c[2], c[3]);
    }
}
