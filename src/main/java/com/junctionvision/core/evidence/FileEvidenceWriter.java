package com.junctionvision.core.evidence;

import com.junctionvision.core.video.VideoRecorders;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Снимки (JPEG, ImageIO) и клипы (MP4, FFmpegFrameRecorder) на локальный диск.
 * Имена: &lt;PLATE&gt;_yyyyMMdd_HHmmss_SSS.jpg и &lt;PLATE&gt;_yyyyMMdd_HHmmss.mp4.
 */
public final class FileEvidenceWriter implements EvidenceWriter {
    private static final Logger log = LoggerFactory.getLogger(FileEvidenceWriter.class);

    private static final DateTimeFormatter SNAP_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final DateTimeFormatter CLIP_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path imagesDir;
    private final Path clipsDir;
    private final ZoneId zone;

    public FileEvidenceWriter(Path imagesDir, Path clipsDir, ZoneId zone) {
        this.imagesDir = Objects.requireNonNull(imagesDir, "imagesDir");
        this.clipsDir = Objects.requireNonNull(clipsDir, "clipsDir");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public String writeSnapshot(BufferedImage frame, String plate, Instant violationTime) {
        Path out = imagesDir.resolve(safe(plate) + "_" + SNAP_TS.format(violationTime.atZone(zone)) + ".jpg");
        try {
            Files.createDirectories(imagesDir);
            if (!ImageIO.write(frame, "jpg", out.toFile())) {
                throw new EvidenceException("no JPEG writer for image type " + frame.getType());
            }
            log.info("Saved violation snapshot to: {}", out);
            return out.toString();
        } catch (IOException e) {
            throw new EvidenceException("snapshot write failed: " + out, e);
        }
    }

    @Override
    public String writeClip(List<BufferedImage> frames, String plate, Instant violationTime, double fps) {
        if (frames == null || frames.isEmpty()) {
            throw new EvidenceException("no frames retained for clip");
        }
        Path out = clipsDir.resolve(safe(plate) + "_" + CLIP_TS.format(violationTime.atZone(zone)) + ".mp4");
        BufferedImage first = frames.get(0);
        Java2DFrameConverter converter = new Java2DFrameConverter();
        FFmpegFrameRecorder recorder = null;
        try {
            recorder = VideoRecorders.startMp4(out, first.getWidth(), first.getHeight(), fps);
            for (BufferedImage f : frames) {
                recorder.record(converter.convert(f));
            }
            recorder.stop();
            log.info("Saved violation clip to: {} ({} frames)", out, frames.size());
            return out.toString();
        } catch (IOException e) {
            throw new EvidenceException("clip write failed: " + out, e);
        } finally {
            if (recorder != null) {
                try {
                    recorder.release();
                } catch (IOException e) {
                    log.warn("clip recorder release failed: {}", e.toString());
                }
            }
            converter.close();
        }
    }

    private static String safe(String plate) {
        String s = plate == null ? "" : plate.replaceAll("[^A-Za-z0-9]", "");
        return s.isEmpty() ? "UNKNOWN" : s;
    }
}
