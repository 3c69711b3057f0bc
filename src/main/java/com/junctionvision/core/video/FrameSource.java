package com.junctionvision.core.video;

import java.io.IOException;
import java.util.Optional;

/** Последовательный источник кадров в порядке возрастания индекса. */
public interface FrameSource extends AutoCloseable {

    /** Следующий кадр или empty на конце потока. */
    Optional<VideoFrame> next() throws IOException;

    double fps();

    int width();

    int height();

    @Override
    void close() throws IOException;
}
