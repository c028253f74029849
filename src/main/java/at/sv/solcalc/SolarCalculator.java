package at.sv.solcalc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Calculates the sun's position relative to a given place and time on earth, using the NOAA solar calculator formulas
 * (<a href="https://gml.noaa.gov/grad/solcalc/">gml.noaa.gov/grad/solcalc</a>).
 * <p>
 * Time accuracy decreases from about one minute at latitudes up to ±72° to about ten minutes beyond that. Atmospheric
 * refraction is taken into account; clouds, air pressure, observer altitude and eclipses are not. Results are most
 * accurate for the years 1800 to 2100.
 * <p>
 * The offset of the given date time must be the one in effect at the given location, it is not validated.
 *
 * @see SunlightCalculator for sunlight levels and their changes
 */
public final class SolarCalculator {

    private SolarCalculator() {
    }

    /**
     * @return the angle of the sun above the horizon in degrees, where 0 is the horizon and 90 is directly overhead
     */
    public static BigDecimal getSolarElevation(ZonedDateTime dateTime, double latitude, double longitude) {
        TimeAndPlace place = new TimeAndPlace(dateTime, latitude, longitude);
        return NoaaFormulas.elevation(place.julianCentury(), place.localTime(), place.latitude(), place.longitude(),
                place.zone());
    }

    /**
     * @return the angle of the sun clockwise from true north in degrees
     */
    public static BigDecimal getSolarAzimuth(ZonedDateTime dateTime, double latitude, double longitude) {
        TimeAndPlace place = new TimeAndPlace(dateTime, latitude, longitude);
        return NoaaFormulas.azimuth(place.julianCentury(), place.localTime(), place.latitude(), place.longitude(),
                place.zone());
    }

    /**
     * Azimuth, elevation and declination at once, cheaper than calculating them separately.
     */
    public static SolarPosition getSolarPosition(ZonedDateTime dateTime, double latitude, double longitude) {
        TimeAndPlace place = new TimeAndPlace(dateTime, latitude, longitude);
        return NoaaFormulas.position(place.julianCentury(), place.localTime(), place.latitude(), place.longitude(),
                place.zone());
    }

    /**
     * The instant on the given date at which the sun transits the meridian of the given longitude. Uses the offset in
     * effect at the start of the day.
     */
    public static ZonedDateTime getSolarNoon(LocalDate date, ZoneId zone, double longitude) {
        ZonedDateTime startOfDay = date.atStartOfDay(zone);
        BigDecimal minutes = NoaaFormulas.solarNoon(NoaaFormulas.julianDay(date), BigDecimal.valueOf(longitude),
                TimeUtil.offsetHours(startOfDay));
        return startOfDay.plus(TimeUtil.durationOfMinutes(minutes));
    }

    private record TimeAndPlace(BigDecimal julianCentury, BigDecimal localTime, BigDecimal zone, BigDecimal latitude,
                                BigDecimal longitude) {

        TimeAndPlace(ZonedDateTime dateTime, double latitude, double longitude) {
            this(dateTime, TimeUtil.minutesSinceStartOfDay(dateTime), TimeUtil.offsetHours(dateTime), latitude, longitude);
        }

        private TimeAndPlace(ZonedDateTime dateTime, BigDecimal localTime, BigDecimal zone, double latitude,
                             double longitude) {
            this(NoaaFormulas.julianCentury(dateTime.toLocalDate(), localTime, zone), localTime, zone,
                    BigDecimal.valueOf(latitude), BigDecimal.valueOf(longitude));
        }
    }
}
