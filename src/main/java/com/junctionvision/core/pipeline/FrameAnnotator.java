package com.junctionvision.core.pipeline;

import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.StopLine;
import com.junctionvision.core.detection.TrackedBox;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.List;

/**
 * Отрисовка кадра: рамки треков, стоп-линия, метка нарушителя.
 * Исходный кадр не меняется - рисуем на копии TYPE_3BYTE_BGR (её же пишет FFmpeg).
 */
public final class FrameAnnotator {

    static final Color TRACK_RED_LIGHT = Color.GREEN;
    static final Color TRACK_GREEN_LIGHT = Color.BLUE;
    static final Color VIOLATOR = Color.RED;
    static final Color LINE_RED = Color.RED;
    static final Color LINE_GREEN = Color.YELLOW;

    private static final Font FONT = new Font(Font.SANS_SERIF, Font.BOLD, 14);

    public BufferedImage render(BufferedImage src, List<TrackedBox> tracks, Collection<Integer> violators,
                                StopLine line, boolean isRed) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
            g.setFont(FONT);
            for (TrackedBox t : tracks) {
                BoundingBox b = t.box();
                if (violators.contains(t.trackId())) {
                    g.setColor(VIOLATOR);
                    g.setStroke(new BasicStroke(4f));
                    g.drawRect(b.x1(), b.y1(), b.width(), b.height());
                    g.drawString("VIOLATION! ID:" + t.trackId(), b.x1(), Math.max(12, b.y1() - 10));
                } else {
                    g.setColor(isRed ? TRACK_RED_LIGHT : TRACK_GREEN_LIGHT);
                    g.setStroke(new BasicStroke(2f));
                    g.drawRect(b.x1(), b.y1(), b.width(), b.height());
                    g.drawString("ID:" + t.trackId(), b.x1(), Math.max(12, b.y1() - 10));
                }
            }
            g.setColor(isRed ? LINE_RED : LINE_GREEN);
            g.setStroke(new BasicStroke(3f));
            g.drawLine(line.x1(), line.y1(), line.x2(), line.y2());
        } finally {
            g.dispose();
        }
        return out;
    }
}
