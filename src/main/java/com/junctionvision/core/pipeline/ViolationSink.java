package com.junctionvision.core.pipeline;

/** Внешний приёмник нарушений. false или исключение - запись не принята; повторов нет. */
@FunctionalInterface
public interface ViolationSink {
    boolean submit(ViolationRecord record);
}
