package at.sv.solcalc.time;

import at.sv.solcalc.SolarTimeOfDay;
import at.sv.solcalc.SunlightChange;
import at.sv.solcalc.SunlightLevel;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Sun times of a fixed place, per calendar date. Near the poles a named time can happen several times a day, or not
 * at all, hence the lists.
 */
public interface SunTimesProvider {

    /**
     * All sunlight changes on the given date, in ascending order.
     */
    List<SunlightChange> getSunlightChanges(LocalDate date);

    ZonedDateTime getNoon(LocalDate date);

    List<ZonedDateTime> getTimes(SolarTimeOfDay timeOfDay, LocalDate date);

    /**
     * Instants on the given date at which the given level starts.
     */
    List<ZonedDateTime> getBeginnings(SunlightLevel level, LocalDate date);

    /**
     * Instants on the given date at which the given level ends.
     */
    List<ZonedDateTime> getEnds(SunlightLevel level, LocalDate date);

    /**
     * Changes on the given date at which the light becomes at least as bright as the given level, or stops being so.
     */
    List<SunlightChange> getRisingIntoOrSettingOutOf(SunlightLevel level, LocalDate date);

    default String toDebugString(LocalDate date) {
        return null;
    }

    void clearCache();
}
