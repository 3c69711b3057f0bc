package com.junctionvision.core.video;

import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.FrameRecorder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Общая настройка MP4-записи (mpeg4 / yuv420p). */
public final class VideoRecorders {

    public static final double DEFAULT_FPS = 30.0;

    private VideoRecorders() {
    }

    /** Создаёт каталог, настраивает и запускает рекордер. Закрывать - вызывающему. */
    public static FFmpegFrameRecorder startMp4(Path out, int width, int height, double fps) throws IOException {
        Path dir = out.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        FFmpegFrameRecorder recorder = new FFmpegFrameRecorder(out.toString(), width, height, 0);
        recorder.setFormat("mp4");
        recorder.setVideoCodec(avcodec.AV_CODEC_ID_MPEG4);
        recorder.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);
        recorder.setFrameRate(fps > 0 ? fps : DEFAULT_FPS);
        recorder.setVideoQuality(0);
        try {
            recorder.start();
        } catch (FrameRecorder.Exception e) {
            recorder.release();
            throw e;
        }
        return recorder;
    }
}
