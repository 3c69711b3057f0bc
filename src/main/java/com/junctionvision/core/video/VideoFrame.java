package com.junctionvision.core.video;

import java.awt.image.BufferedImage;

/** Декодированный кадр; image принадлежит вызывающему (не переиспользуется источником). */
public record VideoFrame(long index, BufferedImage image) {
}
