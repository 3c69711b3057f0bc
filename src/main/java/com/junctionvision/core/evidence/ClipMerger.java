package com.junctionvision.core.evidence;

import com.junctionvision.core.video.VideoRecorders;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Склейка нескольких клипов нарушений в один файл.
 * Отсутствующие/нечитаемые клипы пропускаются; fps и размер берутся у первого читаемого клипа.
 */
public final class ClipMerger {
    private static final Logger log = LoggerFactory.getLogger(ClipMerger.class);

    private ClipMerger() {
    }

    /** @return число реально склеенных клипов (0 - выходной файл не создан) */
    public static int merge(List<Path> clips, Path output) throws IOException {
        if (clips == null || clips.isEmpty()) {
            log.error("No clips provided to merge.");
            return 0;
        }
        List<Path> valid = new ArrayList<>();
        for (Path p : clips) {
            if (Files.isRegularFile(p)) valid.add(p);
            else log.warn("Clip file not found, skipping: {}", p);
        }
        if (valid.isEmpty()) {
            log.error("No valid clips could be loaded for merging.");
            return 0;
        }
        log.info("Attempting to merge {} clips...", valid.size());

        FFmpegFrameRecorder recorder = null;
        int merged = 0;
        try {
            for (Path clip : valid) {
                try (FFmpegFrameGrabber g = new FFmpegFrameGrabber(clip.toFile())) {
                    g.start();
                    if (recorder == null) {
                        recorder = VideoRecorders.startMp4(output, g.getImageWidth(), g.getImageHeight(), g.getFrameRate());
                    } else if (g.getImageWidth() != recorder.getImageWidth()
                            || g.getImageHeight() != recorder.getImageHeight()) {
                        log.warn("Clip {} has size {}x{}, expected {}x{}, skipping", clip,
                                g.getImageWidth(), g.getImageHeight(), recorder.getImageWidth(), recorder.getImageHeight());
                        continue;
                    }
                    Frame f;
                    while ((f = g.grabImage()) != null) {
                        recorder.record(f);
                    }
                    g.stop();
                    merged++;
                } catch (IOException e) {
                    log.error("Error loading clip {}: {}", clip, e.toString());
                }
            }
        } finally {
            if (recorder != null) {
                recorder.stop();
                recorder.release();
            }
        }
        if (merged > 0) log.info("Successfully merged {} clips to: {}", merged, output);
        return merged;
    }
}
