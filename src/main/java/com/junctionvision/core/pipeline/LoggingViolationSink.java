package com.junctionvision.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Приёмник без БД: только строка в лог (sink.mode=log). */
public final class LoggingViolationSink implements ViolationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingViolationSink.class);

    @Override
    public boolean submit(ViolationRecord r) {
        log.info("VIOLATION {} track={} plate={} fine={} loc={} at={} snapshot={} clip={} ocr={}",
                r.violationId(), r.trackId(), r.vehiclePlate(), String.format("%.2f", r.fineAmount()),
                r.locationId(), r.timestamp(), r.imagePath(), r.videoClipPath(), r.ocrConfidence());
        return true;
    }
}
