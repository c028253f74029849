package at.sv.solcalc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

import static at.sv.solcalc.math.DecimalMath.CONTEXT;
import static at.sv.solcalc.math.DecimalMath.PI;
import static at.sv.solcalc.math.DecimalMath.acos;
import static at.sv.solcalc.math.DecimalMath.asin;
import static at.sv.solcalc.math.DecimalMath.cos;
import static at.sv.solcalc.math.DecimalMath.sin;
import static at.sv.solcalc.math.DecimalMath.tan;
import static java.math.BigDecimal.ONE;
import static java.math.BigDecimal.ZERO;

/**
 * The formulas of the NOAA Global Monitoring Laboratory solar calculator
 * (<a href="https://gml.noaa.gov/grad/solcalc/">gml.noaa.gov/grad/solcalc</a>), evaluated with
 * {@link at.sv.solcalc.math.DecimalMath}. The order of operations follows the published JavaScript source, as it
 * determines the rounding of every intermediate result.
 * <p>
 * All angles are in degrees unless the parameter name ends with {@code Rad}, times of day are in minutes since the start
 * of the day, and time zones are UTC offsets in hours.
 */
final class NoaaFormulas {

    private static final BigDecimal J2000 = new BigDecimal("2451545.0");
    private static final BigDecimal DAYS_PER_CENTURY = new BigDecimal("36525.0");
    private static final BigDecimal MINUTES_PER_DAY = BigDecimal.valueOf(1440);
    private static final BigDecimal HOURS_PER_DAY = BigDecimal.valueOf(24);
    private static final BigDecimal HALF_DAY_MINUTES = BigDecimal.valueOf(720);
    private static final BigDecimal DEGREES_PER_HALF_TURN = BigDecimal.valueOf(180);
    private static final BigDecimal DEGREES_PER_TURN = BigDecimal.valueOf(360);
    private static final BigDecimal MINUTES_PER_DEGREE = BigDecimal.valueOf(4);
    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal NINETY = BigDecimal.valueOf(90);
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal AZIMUTH_DENOMINATOR_THRESHOLD = new BigDecimal("0.001");
    private static final BigDecimal ARC_SECONDS_PER_DEGREE = BigDecimal.valueOf(3600);

    private NoaaFormulas() {
    }

    /**
     * Julian day number at midnight UT of the given Gregorian calendar date.
     */
    static BigDecimal julianDay(LocalDate date) {
        int year = date.getYear();
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        BigDecimal century = floor(BigDecimal.valueOf(year).divide(BigDecimal.valueOf(100), CONTEXT));
        return floor(new BigDecimal("365.25").multiply(BigDecimal.valueOf(year + 4716L), CONTEXT))
                .add(floor(new BigDecimal("30.6001").multiply(BigDecimal.valueOf(month + 1L), CONTEXT)), CONTEXT)
                .add(BigDecimal.valueOf(day), CONTEXT)
                .add(TWO.subtract(century, CONTEXT), CONTEXT)
                .add(floor(century.divide(BigDecimal.valueOf(4), CONTEXT)), CONTEXT)
                .subtract(new BigDecimal("1524.5"), CONTEXT);
    }

    /**
     * Julian centuries since J2000.0 for the given date, local time of day and UTC offset.
     */
    static BigDecimal julianCentury(LocalDate date, BigDecimal localTime, BigDecimal zone) {
        BigDecimal julianDay = julianDay(date)
                .add(localTime.divide(MINUTES_PER_DAY, CONTEXT), CONTEXT)
                .subtract(zone.divide(HOURS_PER_DAY, CONTEXT), CONTEXT);
        return julianCentury(julianDay);
    }

    static BigDecimal julianCentury(BigDecimal julianDay) {
        return julianDay.subtract(J2000, CONTEXT).divide(DAYS_PER_CENTURY, CONTEXT);
    }

    static SolarPosition position(BigDecimal t, BigDecimal localTime, BigDecimal latitude, BigDecimal longitude,
                                  BigDecimal zone) {
        Horizon horizon = horizon(t, localTime, latitude, longitude, zone);
        return new SolarPosition(azimuth(horizon), elevation(horizon.zenith()), horizon.declination());
    }

    static BigDecimal elevation(BigDecimal t, BigDecimal localTime, BigDecimal latitude, BigDecimal longitude,
                                BigDecimal zone) {
        return elevation(horizon(t, localTime, latitude, longitude, zone).zenith());
    }

    static BigDecimal azimuth(BigDecimal t, BigDecimal localTime, BigDecimal latitude, BigDecimal longitude,
                              BigDecimal zone) {
        return azimuth(horizon(t, localTime, latitude, longitude, zone));
    }

    private static BigDecimal elevation(BigDecimal zenith) {
        BigDecimal uncorrected = NINETY.subtract(zenith, CONTEXT);
        return NINETY.subtract(zenith.subtract(refraction(uncorrected), CONTEXT), CONTEXT);
    }

    private static BigDecimal azimuth(Horizon horizon) {
        BigDecimal zenithRad = degToRad(horizon.zenith());
        BigDecimal latitudeRad = horizon.latitudeRad();
        BigDecimal denominator = cos(latitudeRad).multiply(sin(zenithRad), CONTEXT);
        BigDecimal azimuth;
        if (denominator.abs().compareTo(AZIMUTH_DENOMINATOR_THRESHOLD) > 0) {
            BigDecimal azimuthRad = sin(latitudeRad).multiply(cos(zenithRad), CONTEXT)
                                                    .subtract(sin(horizon.declinationRad()), CONTEXT)
                                                    .divide(denominator, CONTEXT);
            azimuth = DEGREES_PER_HALF_TURN.subtract(radToDeg(acos(clampToUnit(azimuthRad))), CONTEXT);
            if (horizon.hourAngle().signum() > 0) {
                azimuth = azimuth.negate();
            }
        } else {
            azimuth = radToDeg(latitudeRad).signum() > 0 ? DEGREES_PER_HALF_TURN : ZERO;
        }
        if (azimuth.signum() < 0) {
            azimuth = azimuth.add(DEGREES_PER_TURN, CONTEXT);
        }
        return azimuth;
    }

    private static Horizon horizon(BigDecimal t, BigDecimal localTime, BigDecimal latitude, BigDecimal longitude,
                                   BigDecimal zone) {
        BigDecimal latitudeRad = degToRad(latitude);
        BigDecimal declination = declination(t);
        BigDecimal declinationRad = degToRad(declination);
        BigDecimal trueSolarTime = localTime.add(equationOfTime(t)
                .add(MINUTES_PER_DEGREE.multiply(longitude, CONTEXT), CONTEXT)
                .subtract(SIXTY.multiply(zone, CONTEXT), CONTEXT), CONTEXT);
        trueSolarTime = wrap(trueSolarTime, MINUTES_PER_DAY);

        BigDecimal hourAngle = trueSolarTime.divide(MINUTES_PER_DEGREE, CONTEXT).subtract(DEGREES_PER_HALF_TURN, CONTEXT);
        if (hourAngle.compareTo(DEGREES_PER_HALF_TURN.negate()) < 0) {
            hourAngle = hourAngle.add(DEGREES_PER_TURN, CONTEXT);
        }

        BigDecimal cosZenith = sin(latitudeRad).multiply(sin(declinationRad), CONTEXT)
                                               .add(cos(latitudeRad).multiply(cos(declinationRad), CONTEXT)
                                                                    .multiply(cos(degToRad(hourAngle)), CONTEXT), CONTEXT);
        BigDecimal zenith = radToDeg(acos(clampToUnit(cosZenith)));
        return new Horizon(zenith, latitudeRad, declinationRad, hourAngle, declination);
    }

    /**
     * Atmospheric refraction in degrees for the given uncorrected elevation.
     */
    private static BigDecimal refraction(BigDecimal elevation) {
        if (elevation.compareTo(BigDecimal.valueOf(85)) > 0) {
            return ZERO;
        }
        BigDecimal arcSeconds;
        if (elevation.compareTo(BigDecimal.valueOf(5)) > 0) {
            BigDecimal te = tan(degToRad(elevation));
            BigDecimal teCubed = te.multiply(te, CONTEXT).multiply(te, CONTEXT);
            BigDecimal teFifth = teCubed.multiply(te, CONTEXT).multiply(te, CONTEXT);
            arcSeconds = new BigDecimal("58.1").divide(te, CONTEXT)
                                               .subtract(new BigDecimal("0.07").divide(teCubed, CONTEXT), CONTEXT)
                                               .add(new BigDecimal("0.000086").divide(teFifth, CONTEXT), CONTEXT);
        } else if (elevation.compareTo(new BigDecimal("-0.575")) > 0) {
            BigDecimal polynomial = new BigDecimal("-12.79").add(elevation.multiply(new BigDecimal("0.711"), CONTEXT), CONTEXT);
            polynomial = new BigDecimal("103.4").add(elevation.multiply(polynomial, CONTEXT), CONTEXT);
            polynomial = new BigDecimal("-518.2").add(elevation.multiply(polynomial, CONTEXT), CONTEXT);
            arcSeconds = new BigDecimal("1735.0").add(elevation.multiply(polynomial, CONTEXT), CONTEXT);
        } else {
            arcSeconds = new BigDecimal("-20.774").divide(tan(degToRad(elevation)), CONTEXT);
        }
        return arcSeconds.divide(ARC_SECONDS_PER_DEGREE, CONTEXT);
    }

    static BigDecimal eccentricityOfEarthOrbit(BigDecimal t) {
        BigDecimal inner = new BigDecimal("0.000042037").add(new BigDecimal("0.0000001267").multiply(t, CONTEXT), CONTEXT);
        return new BigDecimal("0.016708634").subtract(t.multiply(inner, CONTEXT), CONTEXT);
    }

    static BigDecimal geometricMeanAnomaly(BigDecimal t) {
        BigDecimal inner = new BigDecimal("35999.05029").subtract(new BigDecimal("0.0001537").multiply(t, CONTEXT), CONTEXT);
        return new BigDecimal("357.52911").add(t.multiply(inner, CONTEXT), CONTEXT);
    }

    static BigDecimal equationOfCenter(BigDecimal t) {
        BigDecimal mRad = degToRad(geometricMeanAnomaly(t));
        BigDecimal first = new BigDecimal("1.914602").subtract(t.multiply(
                new BigDecimal("0.004817").add(new BigDecimal("0.000014").multiply(t, CONTEXT), CONTEXT), CONTEXT), CONTEXT);
        BigDecimal second = new BigDecimal("0.019993").subtract(new BigDecimal("0.000101").multiply(t, CONTEXT), CONTEXT);
        return sin(mRad).multiply(first, CONTEXT)
                        .add(sin(mRad.add(mRad, CONTEXT)).multiply(second, CONTEXT), CONTEXT)
                        .add(sin(mRad.add(mRad, CONTEXT).add(mRad, CONTEXT)).multiply(new BigDecimal("0.000289"), CONTEXT), CONTEXT);
    }

    static BigDecimal geometricMeanLongitude(BigDecimal t) {
        BigDecimal inner = new BigDecimal("36000.76983").add(t.multiply(new BigDecimal("0.0003032"), CONTEXT), CONTEXT);
        BigDecimal longitude = new BigDecimal("280.46646").add(t.multiply(inner, CONTEXT), CONTEXT);
        while (longitude.compareTo(DEGREES_PER_TURN) > 0) {
            longitude = longitude.subtract(DEGREES_PER_TURN, CONTEXT);
        }
        while (longitude.signum() < 0) {
            longitude = longitude.add(DEGREES_PER_TURN, CONTEXT);
        }
        return longitude;
    }

    static BigDecimal trueLongitude(BigDecimal t) {
        return geometricMeanLongitude(t).add(equationOfCenter(t), CONTEXT);
    }

    /**
     * @param omegaRad longitude of the ascending node of the moon in radians
     */
    static BigDecimal apparentLongitude(BigDecimal t, BigDecimal omegaRad) {
        return trueLongitude(t).subtract(new BigDecimal("0.00569"), CONTEXT)
                               .subtract(new BigDecimal("0.00478").multiply(sin(omegaRad), CONTEXT), CONTEXT);
    }

    static BigDecimal meanObliquityOfEcliptic(BigDecimal t) {
        BigDecimal inner = new BigDecimal("0.00059").subtract(t.multiply(new BigDecimal("0.001813"), CONTEXT), CONTEXT);
        inner = new BigDecimal("46.8150").add(t.multiply(inner, CONTEXT), CONTEXT);
        BigDecimal seconds = new BigDecimal("21.448").subtract(t.multiply(inner, CONTEXT), CONTEXT);
        BigDecimal minutes = new BigDecimal("26.0").add(seconds.divide(SIXTY, CONTEXT), CONTEXT);
        return new BigDecimal("23.0").add(minutes.divide(SIXTY, CONTEXT), CONTEXT);
    }

    static BigDecimal obliquityCorrection(BigDecimal t, BigDecimal omegaRad) {
        return meanObliquityOfEcliptic(t).add(new BigDecimal("0.00256").multiply(cos(omegaRad), CONTEXT), CONTEXT);
    }

    static BigDecimal declination(BigDecimal t) {
        BigDecimal omegaRad = omegaRad(t);
        BigDecimal sinDeclination = sin(degToRad(obliquityCorrection(t, omegaRad)))
                .multiply(sin(degToRad(apparentLongitude(t, omegaRad))), CONTEXT);
        return radToDeg(asin(sinDeclination));
    }

    /**
     * Equation of time in minutes.
     */
    static BigDecimal equationOfTime(BigDecimal t) {
        BigDecimal l0Rad = degToRad(geometricMeanLongitude(t));
        BigDecimal e = eccentricityOfEarthOrbit(t);
        BigDecimal mRad = degToRad(geometricMeanAnomaly(t));
        BigDecimal sinM = sin(mRad);
        BigDecimal y = tan(degToRad(obliquityCorrection(t, omegaRad(t))).divide(TWO, CONTEXT));
        y = y.multiply(y, CONTEXT);

        BigDecimal twoL0Rad = TWO.multiply(l0Rad, CONTEXT);
        BigDecimal radians = y.multiply(sin(twoL0Rad), CONTEXT)
                .subtract(TWO.multiply(e, CONTEXT).multiply(sinM, CONTEXT), CONTEXT)
                .add(BigDecimal.valueOf(4).multiply(e, CONTEXT).multiply(y, CONTEXT).multiply(sinM, CONTEXT)
                                          .multiply(cos(twoL0Rad), CONTEXT), CONTEXT)
                .subtract(HALF.multiply(y, CONTEXT).multiply(y, CONTEXT)
                              .multiply(sin(BigDecimal.valueOf(4).multiply(l0Rad, CONTEXT)), CONTEXT), CONTEXT)
                .subtract(new BigDecimal("1.25").multiply(e, CONTEXT).multiply(e, CONTEXT)
                                                .multiply(sin(TWO.multiply(mRad, CONTEXT)), CONTEXT), CONTEXT);
        return radToDeg(radians).multiply(MINUTES_PER_DEGREE, CONTEXT);
    }

    /**
     * Local time of solar noon in minutes since the start of the day. The equation of time is evaluated twice, the second
     * time at the approximate noon found by the first pass.
     *
     * @param julianDay Julian day number at midnight UT of the date
     */
    static BigDecimal solarNoon(BigDecimal julianDay, BigDecimal longitude, BigDecimal zone) {
        BigDecimal longitudeMinutes = longitude.multiply(MINUTES_PER_DEGREE, CONTEXT);
        BigDecimal approximateNoon = julianCentury(julianDay.subtract(longitude.divide(DEGREES_PER_TURN, CONTEXT), CONTEXT));
        BigDecimal noonOffset = HALF_DAY_MINUTES.subtract(longitudeMinutes, CONTEXT)
                                                .subtract(equationOfTime(approximateNoon), CONTEXT);
        BigDecimal refinedNoon = julianCentury(julianDay.subtract(HALF, CONTEXT)
                                                        .add(noonOffset.divide(MINUTES_PER_DAY, CONTEXT), CONTEXT));
        BigDecimal localNoon = HALF_DAY_MINUTES.subtract(longitudeMinutes, CONTEXT)
                                               .subtract(equationOfTime(refinedNoon), CONTEXT)
                                               .add(zone.multiply(SIXTY, CONTEXT), CONTEXT);
        return wrap(localNoon, MINUTES_PER_DAY);
    }

    static BigDecimal radToDeg(BigDecimal angleRad) {
        return DEGREES_PER_HALF_TURN.multiply(angleRad, CONTEXT).divide(PI, CONTEXT);
    }

    static BigDecimal degToRad(BigDecimal angleDeg) {
        return PI.multiply(angleDeg, CONTEXT).divide(DEGREES_PER_HALF_TURN, CONTEXT);
    }

    private static BigDecimal omegaRad(BigDecimal t) {
        return degToRad(new BigDecimal("125.04").subtract(new BigDecimal("1934.136").multiply(t, CONTEXT), CONTEXT));
    }

    /**
     * Wraps the value into [0, period).
     */
    private static BigDecimal wrap(BigDecimal value, BigDecimal period) {
        while (value.signum() < 0) {
            value = value.add(period, CONTEXT);
        }
        while (value.compareTo(period) >= 0) {
            value = value.subtract(period, CONTEXT);
        }
        return value;
    }

    private static BigDecimal clampToUnit(BigDecimal value) {
        if (value.compareTo(ONE) > 0) {
            return ONE;
        }
        if (value.compareTo(ONE.negate()) < 0) {
            return ONE.negate();
        }
        return value;
    }

    private static BigDecimal floor(BigDecimal value) {
        return value.setScale(0, RoundingMode.FLOOR);
    }

    private record Horizon(BigDecimal zenith, BigDecimal latitudeRad, BigDecimal declinationRad, BigDecimal hourAngle,
                           BigDecimal declination) {
    }
}
