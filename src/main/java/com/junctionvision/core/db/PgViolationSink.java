package com.junctionvision.core.db;

import com.junctionvision.core.pipeline.ViolationRecord;
import com.junctionvision.core.pipeline.ViolationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Приёмник нарушений в таблицу violations (sink.mode=db). Одна попытка, без повторов. */
public final class PgViolationSink implements ViolationSink {
    private static final Logger log = LoggerFactory.getLogger(PgViolationSink.class);

    @Override
    public boolean submit(ViolationRecord record) {
        try {
            int id = Pg.insertViolation(record);
            log.debug("violation {} stored as row #{}", record.violationId(), id);
            return true;
        } catch (RuntimeException e) {
            log.error("DB logging failed for {}: {}", record.violationId(), e.getMessage());
            return false;
        }
    }
}
