package com.junctionvision.core.fine;

import com.junctionvision.core.profile.ProfileAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Штраф = база × повторность × школьная зона × ночь, округление до 2 знаков.
 * Порядок множителей фиксирован.
 */
public final class FineCalculator {
    private static final Logger log = LoggerFactory.getLogger(FineCalculator.class);

    public record Params(double baseFine, double repeatMultiplier, double schoolZoneFactor,
                         int nightHourStart, int nightHourEnd, double nightFactor) {

        public static final Params DEFAULTS = new Params(100.0, 1.5, 2.0, 22, 6, 1.2);

        public Params {
            if (baseFine < 0) throw new IllegalArgumentException("baseFine < 0");
            if (repeatMultiplier < 0) throw new IllegalArgumentException("repeatMultiplier < 0: " + repeatMultiplier);
            if (schoolZoneFactor < 0) throw new IllegalArgumentException("schoolZoneFactor < 0: " + schoolZoneFactor);
            if (nightFactor < 0) throw new IllegalArgumentException("nightFactor < 0: " + nightFactor);
            if (nightHourStart < 0 || nightHourStart > 23 || nightHourEnd < 0 || nightHourEnd > 23) {
                throw new IllegalArgumentException("night hours must be in 0..23: " + nightHourStart + ".." + nightHourEnd);
            }
        }
    }

    private FineCalculator() {
    }

    /**
     * @param profile профиль номера до текущего нарушения, может быть null
     * @param zone    контекст места, null = без факторов
     * @param now     местное время нарушения
     */
    public static double compute(ProfileAggregate profile, ZoneFactors zone, LocalDateTime now, Params p) {
        double fine = p.baseFine();

        if (profile != null && profile.totalViolations() > 0) {
            double multiplier = 1.0 + profile.totalViolations() * (p.repeatMultiplier() - 1.0);
            fine *= Math.max(1.0, multiplier);
            log.debug("Fine for {} adjusted by repeat offender factor ({})", profile.plate(), multiplier);
        }
        if (zone != null && zone.schoolZone()) {
            fine *= p.schoolZoneFactor();
            log.debug("Fine adjusted by school zone factor ({})", p.schoolZoneFactor());
        }
        if (isNightHour(now.toLocalTime(), p.nightHourStart(), p.nightHourEnd())) {
            fine *= p.nightFactor();
            log.debug("Fine adjusted by night hour factor ({})", p.nightFactor());
        }
        // точное двоичное значение, а не кратчайшая десятичная запись: 2.675 → 2.67
        return new BigDecimal(fine).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * start ≤ end: диапазон [start, end) - ДЕНЬ, ночь - всё остальное.
     * start &gt; end: диапазон через полночь - НОЧЬ, т.е. [start, 24) ∪ [0, end).
     * Асимметрия намеренная, не «исправлять».
     */
    public static boolean isNightHour(LocalTime t, int nightHourStart, int nightHourEnd) {
        LocalTime start = LocalTime.of(nightHourStart, 0);
        LocalTime end = LocalTime.of(nightHourEnd, 0);
        if (!start.isAfter(end)) {
            boolean day = !t.isBefore(start) && t.isBefore(end);
            return !day;
        }
        return !t.isBefore(start) || t.isBefore(end);
    }
}
