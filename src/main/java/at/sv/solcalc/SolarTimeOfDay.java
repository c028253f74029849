package at.sv.solcalc;

import java.math.BigDecimal;

/**
 * The named instants at which the sun crosses the boundary between two adjacent {@link SunlightLevel}s.
 */
public enum SolarTimeOfDay {
    ASTRONOMICAL_DAWN(-18, true),
    NAUTICAL_DAWN(-12, true),
    CIVIL_DAWN(-6, true),
    SUNRISE(0, true),
    SUNSET(0, false),
    CIVIL_DUSK(-6, false),
    NAUTICAL_DUSK(-12, false),
    ASTRONOMICAL_DUSK(-18, false);

    private final BigDecimal solarElevation;
    private final boolean sunRising;

    SolarTimeOfDay(int solarElevation, boolean sunRising) {
        this.solarElevation = BigDecimal.valueOf(solarElevation);
        this.sunRising = sunRising;
    }

    /**
     * The elevation in degrees the sun crosses at this time of day.
     */
    public BigDecimal getSolarElevation() {
        return solarElevation;
    }

    public boolean isSunRising() {
        return sunRising;
    }

    public SunlightLevel getPreviousSunlightLevel() {
        return switch (this) {
            case ASTRONOMICAL_DAWN -> SunlightLevel.NIGHT;
            case NAUTICAL_DAWN, ASTRONOMICAL_DUSK -> SunlightLevel.ASTRONOMICAL_TWILIGHT;
            case CIVIL_DAWN, NAUTICAL_DUSK -> SunlightLevel.NAUTICAL_TWILIGHT;
            case SUNRISE, CIVIL_DUSK -> SunlightLevel.CIVIL_TWILIGHT;
            case SUNSET -> SunlightLevel.DAYLIGHT;
        };
    }

    public SunlightLevel getNewSunlightLevel() {
        return switch (this) {
            case ASTRONOMICAL_DAWN, NAUTICAL_DUSK -> SunlightLevel.ASTRONOMICAL_TWILIGHT;
            case NAUTICAL_DAWN, CIVIL_DUSK -> SunlightLevel.NAUTICAL_TWILIGHT;
            case CIVIL_DAWN, SUNSET -> SunlightLevel.CIVIL_TWILIGHT;
            case SUNRISE -> SunlightLevel.DAYLIGHT;
            case ASTRONOMICAL_DUSK -> SunlightLevel.NIGHT;
        };
    }
}
