package com.junctionvision.core.fine;

/** Контекст места нарушения, задаётся извне для перекрёстка. */
public record ZoneFactors(boolean schoolZone) {
    public static final ZoneFactors NONE = new ZoneFactors(false);
}
