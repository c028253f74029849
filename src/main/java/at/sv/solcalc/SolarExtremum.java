package at.sv.solcalc;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * A solar noon or solar midnight, where midnight is the preceding noon plus twelve hours. While the declination
 * changes quickly, the sun's actual highest or lowest point can be some minutes away from it.
 */
record SolarExtremum(ZonedDateTime time, boolean noon) {

    SolarExtremum next(double longitude) {
        if (noon) {
            return new SolarExtremum(time.plusHours(12), false);
        }
        LocalDate nextNoonDate = time.minusHours(12).toLocalDate().plusDays(1);
        return new SolarExtremum(SolarCalculator.getSolarNoon(nextNoonDate, time.getZone(), longitude), true);
    }

    SolarExtremum previous(double longitude) {
        if (!noon) {
            return new SolarExtremum(time.minusHours(12), true);
        }
        LocalDate previousNoonDate = time.toLocalDate().minusDays(1);
        return new SolarExtremum(SolarCalculator.getSolarNoon(previousNoonDate, time.getZone(), longitude).plusHours(12),
                false);
    }
}
