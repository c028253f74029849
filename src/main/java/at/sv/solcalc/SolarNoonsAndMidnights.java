package at.sv.solcalc;

import java.time.ZonedDateTime;

/**
 * The solar noons and midnights closest at or before and after an instant. Solar midnight is taken as the preceding
 * solar noon plus twelve hours, which is not exact for solar days that are not exactly 24 hours long.
 */
record SolarNoonsAndMidnights(ZonedDateTime previousNoon, ZonedDateTime previousMidnight, ZonedDateTime nextNoon,
                              ZonedDateTime nextMidnight) {

    /**
     * Scans the dates around the date of {@code start}, alternating forward and backward (0, 1, -1, 2, -2, ...), until
     * all four instants are found. Instants equal to {@code start} count as previous ones.
     */
    static SolarNoonsAndMidnights around(ZonedDateTime start, double longitude) {
        ZonedDateTime previousNoon = null;
        ZonedDateTime previousMidnight = null;
        ZonedDateTime nextNoon = null;
        ZonedDateTime nextMidnight = null;
        for (int daysFromStart = 0;
             previousNoon == null || previousMidnight == null || nextNoon == null || nextMidnight == null;
             daysFromStart = -daysFromStart + (daysFromStart <= 0 ? 1 : 0)) {
            ZonedDateTime noon = SolarCalculator.getSolarNoon(start.toLocalDate().plusDays(daysFromStart),
                    start.getZone(), longitude);
            ZonedDateTime midnight = noon.plusHours(12);

            if (!noon.isAfter(start) && (previousNoon == null || noon.isAfter(previousNoon))) {
                previousNoon = noon;
            }
            if (!midnight.isAfter(start) && (previousMidnight == null || midnight.isAfter(previousMidnight))) {
                previousMidnight = midnight;
            }
            if (noon.isAfter(start) && (nextNoon == null || noon.isBefore(nextNoon))) {
                nextNoon = noon;
            }
            if (midnight.isAfter(start) && (nextMidnight == null || midnight.isBefore(nextMidnight))) {
                nextMidnight = midnight;
            }
        }
        return new SolarNoonsAndMidnights(previousNoon, previousMidnight, nextNoon, nextMidnight);
    }

    /**
     * The later of the previous noon and midnight.
     */
    SolarExtremum previousExtremum() {
        return previousNoon.isAfter(previousMidnight)
                ? new SolarExtremum(previousNoon, true)
                : new SolarExtremum(previousMidnight, false);
    }

    /**
     * The earlier of the next noon and midnight.
     */
    SolarExtremum nextExtremum() {
        return nextNoon.isBefore(nextMidnight)
                ? new SolarExtremum(nextNoon, true)
                : new SolarExtremum(nextMidnight, false);
    }
}
