package com.junctionvision.core.pipeline;

import java.awt.image.BufferedImage;
import java.util.List;

/** Результат кадра: отрисованный кадр и нарушения, зафиксированные на нём. */
public record FrameResult(long frameIndex, BufferedImage rendered, List<ViolationOutcome> outcomes) {

    public FrameResult {
        outcomes = List.copyOf(outcomes);
    }
}
