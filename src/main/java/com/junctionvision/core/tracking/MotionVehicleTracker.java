package com.junctionvision.core.tracking;

import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.TrackedBox;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.bytedeco.javacv.OpenCVFrameConverter;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.global.opencv_video;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_video.BackgroundSubtractorMOG2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Простейший трекер по движению: MOG2 → порог (без теней) → морфология →
 * внешние контуры площадью ≥ minArea → рамки → {@link CentroidAssociator}.
 * Держит состояние фона, поэтому один экземпляр на один видеопоток.
 */
public final class MotionVehicleTracker implements VehicleTracker, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MotionVehicleTracker.class);

    private final int minArea;
    private final BackgroundSubtractorMOG2 mog;
    private final Mat kernel;
    private final CentroidAssociator associator;
    private final Java2DFrameConverter j2d = new Java2DFrameConverter();
    private final OpenCVFrameConverter.ToMat toMat = new OpenCVFrameConverter.ToMat();

    public MotionVehicleTracker(int minArea, int history, double varThreshold, int maxDistance, int maxMissedFrames) {
        this.minArea = Math.max(1, minArea);
        this.mog = opencv_video.createBackgroundSubtractorMOG2(history, varThreshold, true);
        this.kernel = opencv_imgproc.getStructuringElement(opencv_imgproc.MORPH_RECT, new Size(5, 5));
        this.associator = new CentroidAssociator(maxDistance, maxMissedFrames);
        log.info("Motion tracker: minArea={} history={} varThreshold={} maxDistance={} maxMissed={}",
                minArea, history, varThreshold, maxDistance, maxMissedFrames);
    }

    @Override
    public List<TrackedBox> track(BufferedImage frame) {
        Mat bgr = toMat.convert(j2d.convert(frame));
        Mat fg = new Mat();
        MatVector contours = new MatVector();
        Mat hierarchy = new Mat();
        try {
            mog.apply(bgr, fg);
            // тени в MOG2 = 127, оставляем только уверенный передний план
            opencv_imgproc.threshold(fg, fg, 200, 255, opencv_imgproc.THRESH_BINARY);
            opencv_imgproc.morphologyEx(fg, fg, opencv_imgproc.MORPH_OPEN, kernel);
            opencv_imgproc.dilate(fg, fg, kernel);
            opencv_imgproc.findContours(fg, contours, hierarchy,
                    opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);

            List<BoundingBox> boxes = new ArrayList<>();
            for (long i = 0; i < contours.size(); i++) {
                Mat c = contours.get(i);
                if (opencv_imgproc.contourArea(c) >= minArea) {
                    Rect r = opencv_imgproc.boundingRect(c);
                    boxes.add(new BoundingBox(r.x(), r.y(), r.x() + r.width(), r.y() + r.height()));
                    r.close();
                }
                c.release();
            }
            List<TrackedBox> out = associator.assign(boxes);
            if (log.isDebugEnabled()) log.debug("tracker: {} boxes, {} active tracks", out.size(), associator.activeCount());
            return out;
        } finally {
            fg.release();
            hierarchy.release();
            contours.close();
        }
    }

    @Override
    public void close() {
        kernel.release();
        mog.close();
        j2d.close();
        toMat.close();
    }
}
