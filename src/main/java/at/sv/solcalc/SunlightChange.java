package at.sv.solcalc;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * The instant at which the sunlight level changes. Previous and new level as well as the direction of the sun are
 * derived from the {@link SolarTimeOfDay name}.
 */
public record SunlightChange(ZonedDateTime time, SolarTimeOfDay name) {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public SunlightChange {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(name, "name");
    }

    public SunlightLevel getPreviousSunlightLevel() {
        return name.getPreviousSunlightLevel();
    }

    public SunlightLevel getNewSunlightLevel() {
        return name.getNewSunlightLevel();
    }

    public boolean isSunRising() {
        return name.isSunRising();
    }

    @Override
    public String toString() {
        return name + " at " + TIME_FORMATTER.format(time) + " (" + getPreviousSunlightLevel() + " -> " +
               getNewSunlightLevel() + ")";
    }
}
