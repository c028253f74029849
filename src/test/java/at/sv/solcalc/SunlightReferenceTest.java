package at.sv.solcalc;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cross-checks the sunlight changes with the commons-suncalc library, which uses a different algorithm.
 */
class SunlightReferenceTest {

    private static final Duration TOLERANCE = Duration.ofMinutes(3);

    private final SunlightCalculator calculator = new SunlightCalculator();

    @ParameterizedTest
    @CsvSource({
            "2021-01-01, Europe/Vienna, 48.20, 16.39",
            "2021-06-21, Europe/Vienna, 48.20, 16.39",
            "2024-01-28, America/Los_Angeles, 37.35, -121.95",
            "2024-03-31, Australia/Sydney, -33.87, 151.21",
            "2024-09-23, Asia/Singapore, 1.35, 103.82",
            "2024-11-05, America/Sao_Paulo, -23.55, -46.63"
    })
    void sunriseAndSunset_matchSuncalc(LocalDate date, String zoneId, double lat, double lng) {
        ZoneId zone = ZoneId.of(zoneId);
        List<SunlightChange> changes = calculator.getSunlightChangesOn(date, zone, lat, lng);

        SunTimes upperLimb = compute(date, zone, lat, lng, SunTimes.Twilight.VISUAL);
        SunTimes lowerLimb = compute(date, zone, lat, lng, SunTimes.Twilight.VISUAL_LOWER);
        SunTimes civil = compute(date, zone, lat, lng, SunTimes.Twilight.CIVIL);
        SunTimes nautical = compute(date, zone, lat, lng, SunTimes.Twilight.NAUTICAL);

        assertClose(changes, SolarTimeOfDay.SUNRISE, between(upperLimb.getRise(), lowerLimb.getRise()));
        assertClose(changes, SolarTimeOfDay.SUNSET, between(upperLimb.getSet(), lowerLimb.getSet()));
        assertClose(changes, SolarTimeOfDay.CIVIL_DAWN, civil.getRise());
        assertClose(changes, SolarTimeOfDay.CIVIL_DUSK, civil.getSet());
        assertClose(changes, SolarTimeOfDay.NAUTICAL_DAWN, nautical.getRise());
        assertClose(changes, SolarTimeOfDay.NAUTICAL_DUSK, nautical.getSet());
    }

    private static SunTimes compute(LocalDate date, ZoneId zone, double lat, double lng, SunTimes.Twilight twilight) {
        return SunTimes.compute()
                       .on(date.atStartOfDay(zone))
                       .at(lat, lng)
                       .oneDay()
                       .twilight(twilight)
                       .execute();
    }

    /**
     * Sunrise and sunset are defined by the refracted center of the sun, half way between its upper and lower limb.
     */
    private static ZonedDateTime between(ZonedDateTime upperLimb, ZonedDateTime lowerLimb) {
        if (upperLimb == null || lowerLimb == null) {
            return null;
        }
        return upperLimb.plus(Duration.between(upperLimb, lowerLimb).dividedBy(2));
    }

    private static void assertClose(List<SunlightChange> changes, SolarTimeOfDay name, ZonedDateTime expected) {
        assertThat(expected).as("suncalc %s", name).isNotNull();
        assertThat(changes).filteredOn(change -> change.name() == name)
                           .singleElement()
                           .satisfies(change -> assertThat(Duration.between(expected, change.time()).abs())
                                   .as("%s at %s, suncalc %s", name, change.time(), expected)
                                   .isLessThanOrEqualTo(TOLERANCE));
    }
}
