package com.junctionvision.core.video;

import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/** Запись аннотированного видео (--output). */
public final class AnnotatedVideoWriter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnnotatedVideoWriter.class);

    private final Path out;
    private final FFmpegFrameRecorder recorder;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private long written = 0;

    public AnnotatedVideoWriter(Path out, int width, int height, double fps) throws IOException {
        this.out = out;
        this.recorder = VideoRecorders.startMp4(out, width, height, fps);
        log.info("VideoWriter created: {}, Resolution: {}x{}, FPS: {}", out, width, height, fps);
    }

    public void write(BufferedImage frame) throws IOException {
        recorder.record(converter.convert(frame));
        written++;
    }

    @Override
    public void close() throws IOException {
        try {
            recorder.stop();
            recorder.release();
        } finally {
            converter.close();
        }
        log.info("Annotated video saved to: {} ({} frames)", out, written);
    }
}
