package at.sv.solcalc;

import java.math.BigDecimal;

/**
 * How much the sun lights up a place, ordered from darkest to brightest. Each level covers a half-open range of solar
 * elevations, starting at its {@link #getMinimumSolarElevation() minimum}.
 */
public enum SunlightLevel {
    /**
     * Sun at least 18° below the horizon.
     */
    NIGHT(-90),
    /**
     * Sun between 18° and 12° below the horizon.
     */
    ASTRONOMICAL_TWILIGHT(-18),
    /**
     * Sun between 12° and 6° below the horizon.
     */
    NAUTICAL_TWILIGHT(-12),
    /**
     * Sun less than 6° below the horizon.
     */
    CIVIL_TWILIGHT(-6),
    /**
     * Sun on or above the horizon.
     */
    DAYLIGHT(0);

    private final BigDecimal minimumSolarElevation;

    SunlightLevel(int minimumSolarElevation) {
        this.minimumSolarElevation = BigDecimal.valueOf(minimumSolarElevation);
    }

    public static SunlightLevel forSolarElevation(BigDecimal elevation) {
        if (elevation.compareTo(DAYLIGHT.minimumSolarElevation) >= 0) {
            return DAYLIGHT;
        } else if (elevation.compareTo(CIVIL_TWILIGHT.minimumSolarElevation) >= 0) {
            return CIVIL_TWILIGHT;
        } else if (elevation.compareTo(NAUTICAL_TWILIGHT.minimumSolarElevation) >= 0) {
            return NAUTICAL_TWILIGHT;
        } else if (elevation.compareTo(ASTRONOMICAL_TWILIGHT.minimumSolarElevation) >= 0) {
            return ASTRONOMICAL_TWILIGHT;
        }
        return NIGHT;
    }

    public BigDecimal getMinimumSolarElevation() {
        return minimumSolarElevation;
    }

    /**
     * The event that starts this level when the sun moves in the given direction. Daylight and night can only be
     * entered in one direction, so their start ignores it.
     */
    public SolarTimeOfDay getStart(boolean sunRising) {
        return switch (this) {
            case ASTRONOMICAL_TWILIGHT -> sunRising ? SolarTimeOfDay.ASTRONOMICAL_DAWN : SolarTimeOfDay.NAUTICAL_DUSK;
            case NAUTICAL_TWILIGHT -> sunRising ? SolarTimeOfDay.NAUTICAL_DAWN : SolarTimeOfDay.CIVIL_DUSK;
            case CIVIL_TWILIGHT -> sunRising ? SolarTimeOfDay.CIVIL_DAWN : SolarTimeOfDay.SUNSET;
            case DAYLIGHT -> SolarTimeOfDay.SUNRISE;
            case NIGHT -> SolarTimeOfDay.ASTRONOMICAL_DUSK;
        };
    }

    /**
     * The event that ends this level when the sun moves in the given direction. Daylight and night can only be left in
     * one direction, so their end ignores it.
     */
    public SolarTimeOfDay getEnd(boolean sunRising) {
        return switch (this) {
            case ASTRONOMICAL_TWILIGHT -> sunRising ? SolarTimeOfDay.NAUTICAL_DAWN : SolarTimeOfDay.ASTRONOMICAL_DUSK;
            case NAUTICAL_TWILIGHT -> sunRising ? SolarTimeOfDay.CIVIL_DAWN : SolarTimeOfDay.NAUTICAL_DUSK;
            case CIVIL_TWILIGHT -> sunRising ? SolarTimeOfDay.SUNRISE : SolarTimeOfDay.CIVIL_DUSK;
            case DAYLIGHT -> SolarTimeOfDay.SUNSET;
            case NIGHT -> SolarTimeOfDay.ASTRONOMICAL_DAWN;
        };
    }
}
