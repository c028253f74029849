package at.sv.solcalc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static at.sv.solcalc.SolarTimeOfDay.ASTRONOMICAL_DAWN;
import static at.sv.solcalc.SolarTimeOfDay.ASTRONOMICAL_DUSK;
import static at.sv.solcalc.SolarTimeOfDay.CIVIL_DAWN;
import static at.sv.solcalc.SolarTimeOfDay.CIVIL_DUSK;
import static at.sv.solcalc.SolarTimeOfDay.NAUTICAL_DAWN;
import static at.sv.solcalc.SolarTimeOfDay.NAUTICAL_DUSK;
import static at.sv.solcalc.SolarTimeOfDay.SUNRISE;
import static at.sv.solcalc.SolarTimeOfDay.SUNSET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SunlightCalculatorTest {

    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");
    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
    private static final double SANTA_CLARA_LAT = 37.35;
    private static final double SANTA_CLARA_LONG = -121.95;
    private static final double SVALBARD_LAT = 78.92;
    private static final double SVALBARD_LONG = 11.93;
    private static final Duration TOLERANCE = Duration.ofMinutes(2);

    private SunlightCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new SunlightCalculator();
    }

    private static ZonedDateTime losAngeles(int month, int day, int hour, int minute) {
        return ZonedDateTime.of(2024, month, day, hour, minute, 0, 0, LOS_ANGELES);
    }

    private static ZonedDateTime berlin(int month, int day, int hour, int minute) {
        return ZonedDateTime.of(2024, month, day, hour, minute, 0, 0, BERLIN);
    }

    private static void assertChange(SunlightChange actual, ZonedDateTime expectedTime, SolarTimeOfDay expectedName) {
        assertThat(actual.name()).isEqualTo(expectedName);
        assertThat(Duration.between(expectedTime, actual.time()).abs())
                .as("%s at %s, expected %s", actual.name(), actual.time(), expectedTime)
                .isLessThanOrEqualTo(TOLERANCE);
    }

    private static void assertChanges(List<SunlightChange> actual, SunlightChange... expected) {
        assertThat(actual).extracting(SunlightChange::name)
                          .containsExactly(List.of(expected).stream().map(SunlightChange::name).toArray(SolarTimeOfDay[]::new));
        for (int i = 0; i < expected.length; i++) {
            assertChange(actual.get(i), expected[i].time(), expected[i].name());
        }
    }

    @Test
    void getSunlightAt_classifiesSolarElevation() {
        assertThat(calculator.getSunlightAt(losAngeles(1, 23, 6, 0), 37.77, -122.42))
                .isEqualTo(SunlightLevel.ASTRONOMICAL_TWILIGHT);
        assertThat(calculator.getSunlightAt(losAngeles(1, 28, 12, 0), SANTA_CLARA_LAT, SANTA_CLARA_LONG))
                .isEqualTo(SunlightLevel.DAYLIGHT);
        assertThat(calculator.getSunlightAt(losAngeles(1, 28, 0, 0), SANTA_CLARA_LAT, SANTA_CLARA_LONG))
                .isEqualTo(SunlightLevel.NIGHT);
    }

    @Test
    void getNextSunlightChange_afternoon_returnsSunset() {
        SunlightChange change = calculator.getNextSunlightChange(losAngeles(1, 28, 14, 5), SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        assertChange(change, losAngeles(1, 28, 17, 27), SUNSET);
        assertThat(change.getPreviousSunlightLevel()).isEqualTo(SunlightLevel.DAYLIGHT);
        assertThat(change.getNewSunlightLevel()).isEqualTo(SunlightLevel.CIVIL_TWILIGHT);
    }

    @Test
    void getSunlightChangesOn_normalDayInCalifornia_returnsAllEightChanges() {
        List<SunlightChange> changes = calculator.getSunlightChangesOn(LocalDate.of(2024, 1, 28), LOS_ANGELES,
                SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        assertChanges(changes,
                new SunlightChange(losAngeles(1, 28, 5, 44), ASTRONOMICAL_DAWN),
                new SunlightChange(losAngeles(1, 28, 6, 15), NAUTICAL_DAWN),
                new SunlightChange(losAngeles(1, 28, 6, 46), CIVIL_DAWN),
                new SunlightChange(losAngeles(1, 28, 7, 14), SUNRISE),
                new SunlightChange(losAngeles(1, 28, 17, 27), SUNSET),
                new SunlightChange(losAngeles(1, 28, 17, 55), CIVIL_DUSK),
                new SunlightChange(losAngeles(1, 28, 18, 26), NAUTICAL_DUSK),
                new SunlightChange(losAngeles(1, 28, 18, 57), ASTRONOMICAL_DUSK));
    }

    @Test
    void getSunlightChangesOn_svalbardInSeptember_hasCivilDuskTwice() {
        List<SunlightChange> changes = calculator.getSunlightChangesOn(LocalDate.of(2024, 9, 10), BERLIN,
                SVALBARD_LAT, SVALBARD_LONG);

        assertChanges(changes,
                new SunlightChange(berlin(9, 10, 0, 28), CIVIL_DUSK),
                new SunlightChange(berlin(9, 10, 1, 53), CIVIL_DAWN),
                new SunlightChange(berlin(9, 10, 5, 15), SUNRISE),
                new SunlightChange(berlin(9, 10, 20, 58), SUNSET),
                new SunlightChange(berlin(9, 10, 23, 57), CIVIL_DUSK));
    }

    @Test
    void getSunlightChangesOn_svalbardInApril_polarDay_isEmpty() {
        List<SunlightChange> changes = calculator.getSunlightChangesOn(LocalDate.of(2024, 4, 17), BERLIN,
                SVALBARD_LAT, SVALBARD_LONG);

        assertThat(changes).isEmpty();
    }

    @Test
    void getSunlightChanges_isStrictlyIncreasing_andRepeatsDailyPattern() {
        Iterator<SunlightChange> changes = calculator.getSunlightChanges(losAngeles(1, 28, 0, 0), SANTA_CLARA_LAT,
                SANTA_CLARA_LONG);

        ZonedDateTime previous = losAngeles(1, 28, 0, 0);
        for (int i = 0; i < 24; i++) {
            assertThat(changes.hasNext()).isTrue();
            SunlightChange change = changes.next();

            assertThat(change.time()).isAfter(previous);
            assertThat(change.name()).isEqualTo(SolarTimeOfDay.values()[i % 8]);
            previous = change.time();
        }
    }

    @Test
    void changeTimes_haveDefiningSolarElevation() {
        List<SunlightChange> changes = calculator.streamSunlightChanges(losAngeles(6, 21, 0, 0), SANTA_CLARA_LAT,
                                                         SANTA_CLARA_LONG)
                                                 .limit(16)
                                                 .collect(Collectors.toList());

        assertDefiningElevations(changes, SANTA_CLARA_LAT, SANTA_CLARA_LONG);
    }

    @Test
    void getSunlightChangesOn_svalbardInFebruary_firstSunriseAfterPolarNight() {
        List<SunlightChange> changes = calculator.getSunlightChangesOn(LocalDate.of(2024, 2, 20), BERLIN,
                SVALBARD_LAT, SVALBARD_LONG);

        assertThat(changes).extracting(SunlightChange::name)
                           .containsExactly(ASTRONOMICAL_DAWN, NAUTICAL_DAWN, CIVIL_DAWN, SUNRISE, SUNSET, CIVIL_DUSK,
                                   NAUTICAL_DUSK, ASTRONOMICAL_DUSK);
        assertChange(changes.get(3), berlin(2, 20, 11, 7), SUNRISE);
        assertChange(changes.get(4), berlin(2, 20, 13, 47), SUNSET);
    }

    @Test
    void getNextSunlightChange_svalbardInFebruary_betweenSunriseAndSunset_returnsSunsetOfSameDay() {
        SunlightChange change = calculator.getNextSunlightChange(berlin(2, 20, 11, 9), SVALBARD_LAT, SVALBARD_LONG);

        assertChange(change, berlin(2, 20, 13, 47), SUNSET);
    }

    @Test
    void getSunlightChanges_svalbardAroundEndOfPolarNight_consistentForFortyDays() {
        ZonedDateTime start = berlin(2, 10, 0, 0);

        List<SunlightChange> changes = calculator.streamSunlightChanges(start, SVALBARD_LAT, SVALBARD_LONG)
                                                 .takeWhile(change -> change.time().isBefore(start.plusDays(40)))
                                                 .collect(Collectors.toList());

        assertConsistentSequence(start, changes);
        assertDefiningElevations(changes, SVALBARD_LAT, SVALBARD_LONG);
        assertThat(changes).filteredOn(change -> change.name() == SUNRISE).hasSizeGreaterThanOrEqualTo(20);
        assertThat(changes).filteredOn(change -> change.name() == CIVIL_DUSK).hasSizeGreaterThanOrEqualTo(39);
    }

    @Test
    void getSunlightChanges_alertInAutumn_consistentForFortyDays() {
        ZonedDateTime start = ZonedDateTime.of(2024, 10, 10, 0, 0, 0, 0, ZoneId.of("America/Toronto"));
        double latitude = 82.5;
        double longitude = -62.3;

        List<SunlightChange> changes = calculator.streamSunlightChanges(start, latitude, longitude)
                                                 .takeWhile(change -> change.time().isBefore(start.plusDays(40)))
                                                 .collect(Collectors.toList());

        assertConsistentSequence(start, changes);
        assertDefiningElevations(changes, latitude, longitude);
        assertThat(changes).filteredOn(change -> change.name() == ASTRONOMICAL_DUSK).isNotEmpty();
    }

    private static void assertConsistentSequence(ZonedDateTime start, List<SunlightChange> changes) {
        assertThat(changes).isNotEmpty();
        assertThat(changes.get(0).time()).isAfter(start);
        for (int i = 1; i < changes.size(); i++) {
            SunlightChange previous = changes.get(i - 1);
            SunlightChange next = changes.get(i);

            assertThat(next.time()).as("%s after %s", next, previous).isAfter(previous.time());
            assertThat(next.getPreviousSunlightLevel()).as("%s after %s", next, previous)
                                                       .isEqualTo(previous.getNewSunlightLevel());
        }
    }

    private void assertDefiningElevations(List<SunlightChange> changes, double latitude, double longitude) {
        BigDecimal precision = calculator.getSettings().getElevationPrecision();
        for (SunlightChange change : changes) {
            BigDecimal elevation = SolarCalculator.getSolarElevation(change.time(), latitude, longitude);

            assertThat(elevation).as(change.toString())
                                 .isCloseTo(change.name().getSolarElevation(), within(precision));
        }
    }

    @Test
    void getNextSunlightChange_seededJustAfterChange_returnsLaterChange() {
        SunlightChange first = calculator.getNextSunlightChange(losAngeles(6, 1, 12, 0), SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        SunlightChange second = calculator.getNextSunlightChange(first.time().plusSeconds(1), SANTA_CLARA_LAT,
                SANTA_CLARA_LONG);

        assertThat(first.name()).isEqualTo(SUNSET);
        assertThat(second.name()).isEqualTo(CIVIL_DUSK);
        assertThat(second.time()).isAfter(first.time().plusMinutes(10));
    }

    @Test
    void streamSunlightChanges_equalsIterator() {
        ZonedDateTime start = losAngeles(3, 10, 12, 0);
        Iterator<SunlightChange> iterator = calculator.getSunlightChanges(start, SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        List<SunlightChange> streamed = calculator.streamSunlightChanges(start, SANTA_CLARA_LAT, SANTA_CLARA_LONG)
                                                  .limit(3)
                                                  .collect(Collectors.toList());

        assertThat(streamed).containsExactly(iterator.next(), iterator.next(), iterator.next());
    }

    @Test
    void getSunlightChangesOn_daylightSavingTimeChange_usesZoneOfDay() {
        List<SunlightChange> changes = calculator.getSunlightChangesOn(LocalDate.of(2024, 3, 10), LOS_ANGELES,
                SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        assertThat(changes).hasSize(8);
        assertThat(changes.get(3).name()).isEqualTo(SUNRISE);
        assertThat(changes.get(3).time().getOffset().getTotalSeconds()).isEqualTo(-7 * 3600);
        assertThat(changes.get(3).time().getHour()).isEqualTo(7);
    }

    @Test
    void coarseSettings_stillFindSameChanges() {
        SunlightCalculator coarse = new SunlightCalculator(SunlightCalculationSettings.builder()
                                                                                     .elevationPrecision(new BigDecimal("0.05"))
                                                                                     .maxIterations(3)
                                                                                     .build());

        SunlightChange change = coarse.getNextSunlightChange(losAngeles(1, 28, 14, 5), SANTA_CLARA_LAT, SANTA_CLARA_LONG);

        assertChange(change, losAngeles(1, 28, 17, 27), SUNSET);
    }

    @Test
    void singleIteration_returnsInitialEstimate_closeToResult() {
        SunlightCalculator estimateOnly = new SunlightCalculator(SunlightCalculationSettings.builder()
                                                                                           .maxIterations(1)
                                                                                           .build());

        SunlightChange change = estimateOnly.getNextSunlightChange(losAngeles(1, 28, 14, 5), SANTA_CLARA_LAT,
                SANTA_CLARA_LONG);

        assertThat(change.name()).isEqualTo(SUNSET);
        assertThat(Duration.between(losAngeles(1, 28, 17, 27), change.time()).abs()).isLessThan(Duration.ofMinutes(30));
    }

    @Test
    void persistingLevel_beyondSkipLimit_throws() {
        SunlightCalculator impatient = new SunlightCalculator(SunlightCalculationSettings.builder()
                                                                                        .maxSkippedHalfDays(4)
                                                                                        .build());

        assertThatThrownBy(() -> impatient.getNextSunlightChange(berlin(4, 17, 0, 0), SVALBARD_LAT, SVALBARD_LONG))
                .isInstanceOf(SunlightChangeNotFound.class)
                .hasMessageContaining("4 half-days");
    }

    @Test
    void invalidSettings_areRejected() {
        assertThatThrownBy(() -> new SunlightCalculator(SunlightCalculationSettings.builder()
                                                                                   .elevationPrecision(BigDecimal.ZERO)
                                                                                   .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("elevationPrecision");
        assertThatThrownBy(() -> new SunlightCalculator(SunlightCalculationSettings.builder().maxIterations(0).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIterations");
        assertThatThrownBy(() -> new SunlightCalculator(SunlightCalculationSettings.builder().padding(Duration.ZERO).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("padding");
        assertThatThrownBy(() -> new SunlightCalculator(SunlightCalculationSettings.builder().maxSkippedHalfDays(-1).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSkippedHalfDays");
    }

    @Test
    void settings_toBuilder_keepsOtherValues() {
        SunlightCalculationSettings settings = SunlightCalculationSettings.DEFAULT.toBuilder().maxIterations(7).build();

        assertThat(settings.getMaxIterations()).isEqualTo(7);
        assertThat(settings.getElevationPrecision()).isEqualByComparingTo("0.0001");
        assertThat(settings.getPadding()).isEqualTo(Duration.ofMinutes(1));
        assertThat(settings.getMaxSkippedHalfDays()).isEqualTo(1000);
        assertThat(SunlightCalculationSettings.DEFAULT.getMaxIterations()).isEqualTo(50);
    }

    @Test
    void defaultSettings() {
        SunlightCalculationSettings settings = calculator.getSettings();

        assertThat(settings.getElevationPrecision()).isEqualByComparingTo("0.0001");
        assertThat(settings.getMaxIterations()).isEqualTo(50);
        assertThat(settings.getPadding()).isEqualTo(Duration.ofMinutes(1));
        assertThat(settings.getMaxSkippedHalfDays()).isEqualTo(1000);
    }
}
