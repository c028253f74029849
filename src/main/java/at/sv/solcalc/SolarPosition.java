package at.sv.solcalc;

import java.math.BigDecimal;

/**
 * The sun's position relative to a point on earth at a specific instant. All angles are in degrees.
 *
 * @param azimuth     horizontal angle clockwise from true north, in [0, 360)
 * @param elevation   vertical angle above the horizon, 0 is the horizon and 90 is directly overhead
 * @param declination vertical angle above the equator, 0 at an equinox, positive during northern summer
 */
public record SolarPosition(BigDecimal azimuth, BigDecimal elevation, BigDecimal declination) {
}
