package at.sv.solcalc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What {@link SolCalc} prints in JSON mode.
 */
public record SunlightReport(String time, double latitude, double longitude, SunlightLevel sunlightLevel,
                             BigDecimal azimuth, BigDecimal elevation, BigDecimal declination, Change nextChange,
                             String noon, List<Change> changes) {

    private static final int ANGLE_SCALE = 4;

    static SunlightReport of(ZonedDateTime time, double latitude, double longitude, SunlightLevel level,
                             SolarPosition position, SunlightChange nextChange, ZonedDateTime noon,
                             List<SunlightChange> changes) {
        return new SunlightReport(format(time), latitude, longitude, level, round(position.azimuth()),
                round(position.elevation()), round(position.declination()), Change.of(nextChange), format(noon),
                changes.stream().map(Change::of).collect(Collectors.toList()));
    }

    private static BigDecimal round(BigDecimal angle) {
        return angle.setScale(ANGLE_SCALE, RoundingMode.HALF_EVEN);
    }

    private static String format(ZonedDateTime time) {
        if (time == null) {
            return null;
        }
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time.withNano(0));
    }

    public record Change(String time, SolarTimeOfDay name, SunlightLevel previousSunlightLevel,
                         SunlightLevel newSunlightLevel) {

        static Change of(SunlightChange change) {
            if (change == null) {
                return null;
            }
            return new Change(format(change.time()), change.name(), change.getPreviousSunlightLevel(),
                    change.getNewSunlightLevel());
        }
    }
}
