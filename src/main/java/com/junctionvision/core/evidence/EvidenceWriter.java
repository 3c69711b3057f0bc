package com.junctionvision.core.evidence;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.List;

/** Запись доказательств нарушения. Ошибки - {@link EvidenceException}. */
public interface EvidenceWriter {

    String SNAPSHOT_FAILED = "Failed to save snapshot";
    String CLIP_FAILED = "Failed to save clip";

    /** @return путь к сохранённому снимку */
    String writeSnapshot(BufferedImage frame, String plate, Instant violationTime);

    /** @return путь к сохранённому клипу */
    String writeClip(List<BufferedImage> frames, String plate, Instant violationTime, double fps);
}
