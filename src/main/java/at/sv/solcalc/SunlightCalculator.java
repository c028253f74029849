package at.sv.solcalc;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Calculates the level of sunlight at a place on earth and the instants at which it changes, like sunrise or civil
 * dusk. Weather, observer altitude and eclipses are not taken into account.
 * <p>
 * All date times passed in must carry the offset in effect at the given location. Instances are immutable and can be
 * shared between threads.
 *
 * @see SolarCalculator for the underlying solar position
 */
public final class SunlightCalculator {

    private final SunlightCalculationSettings settings;
    private final SunlightChangeFinder finder;

    public SunlightCalculator() {
        this(SunlightCalculationSettings.DEFAULT);
    }

    public SunlightCalculator(SunlightCalculationSettings settings) {
        settings.validate();
        this.settings = settings;
        finder = new SunlightChangeFinder(settings);
    }

    public SunlightLevel getSunlightAt(ZonedDateTime time, double latitude, double longitude) {
        return SunlightLevel.forSolarElevation(SolarCalculator.getSolarElevation(time, latitude, longitude));
    }

    /**
     * @return the first change strictly after {@code start}
     * @throws SunlightChangeNotFound if the level does not change within the configured number of half-days
     */
    public SunlightChange getNextSunlightChange(ZonedDateTime start, double latitude, double longitude) {
        return finder.findNext(start, latitude, longitude);
    }

    /**
     * The endless sequence of changes after {@code start}. To get the sunrise of a day, take changes while they are on
     * that day, never collect all of them.
     */
    public SunlightChangeIterator getSunlightChanges(ZonedDateTime start, double latitude, double longitude) {
        return new SunlightChangeIterator(finder, start, latitude, longitude, settings.getPadding());
    }

    /**
     * Endless stream view of {@link #getSunlightChanges(ZonedDateTime, double, double)}, to be limited with
     * {@link Stream#limit(long)} or {@link Stream#takeWhile(java.util.function.Predicate)}.
     */
    public Stream<SunlightChange> streamSunlightChanges(ZonedDateTime start, double latitude, double longitude) {
        Spliterator<SunlightChange> spliterator = Spliterators.spliteratorUnknownSize(
                getSunlightChanges(start, latitude, longitude), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * All changes on the given date, in ascending order. Empty if the level persists all day.
     */
    public List<SunlightChange> getSunlightChangesOn(LocalDate date, ZoneId zone, double latitude, double longitude) {
        return streamSunlightChanges(date.atStartOfDay(zone), latitude, longitude)
                .takeWhile(change -> change.time().toLocalDate().equals(date))
                .collect(Collectors.toList());
    }

    public SunlightCalculationSettings getSettings() {
        return settings;
    }
}
