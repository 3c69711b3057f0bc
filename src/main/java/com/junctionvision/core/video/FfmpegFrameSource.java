package com.junctionvision.core.video;

import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Декодирование видеофайла через FFmpegFrameGrabber. */
public final class FfmpegFrameSource implements FrameSource {
    private static final Logger log = LoggerFactory.getLogger(FfmpegFrameSource.class);

    private final Path video;
    private final FFmpegFrameGrabber grabber;
    private final Java2DFrameConverter converter = new Java2DFrameConverter();
    private final double fps;
    private long nextIndex = 0;

    private FfmpegFrameSource(Path video, FFmpegFrameGrabber grabber, double fps) {
        this.video = video;
        this.grabber = grabber;
        this.fps = fps;
    }

    /** Фатально, если файл не открывается: ни один кадр не будет обработан. */
    public static FfmpegFrameSource open(Path video) throws IOException {
        if (!Files.isRegularFile(video) || Files.size(video) == 0L) {
            throw new IOException("Cannot open video file: " + video);
        }
        FFmpegFrameGrabber g = new FFmpegFrameGrabber(video.toFile());
        try {
            g.start();
        } catch (FrameGrabber.Exception e) {
            g.release();
            throw new IOException("Cannot open video file: " + video, e);
        }
        double fps = g.getFrameRate();
        if (!(fps > 1e-3)) fps = VideoRecorders.DEFAULT_FPS;
        log.info("Video opened: {} {}x{} fps={} frames~{}",
                video, g.getImageWidth(), g.getImageHeight(), fps, g.getLengthInVideoFrames());
        return new FfmpegFrameSource(video, g, fps);
    }

    @Override
    public Optional<VideoFrame> next() throws IOException {
        Frame f = grabber.grabImage();
        if (f == null) return Optional.empty();
        // конвертер переиспользует буфер → копия обязательна
        var img = Java2DFrameConverter.cloneBufferedImage(converter.getBufferedImage(f));
        return Optional.of(new VideoFrame(nextIndex++, img));
    }

    @Override
    public double fps() {
        return fps;
    }

    @Override
    public int width() {
        return grabber.getImageWidth();
    }

    @Override
    public int height() {
        return grabber.getImageHeight();
    }

    @Override
    public void close() throws IOException {
        try {
            grabber.stop();
            grabber.release();
        } finally {
            converter.close();
            log.debug("Video closed: {} after {} frames", video, nextIndex);
        }
    }
}
