package at.sv.solcalc.time;

import at.sv.solcalc.SolarCalculator;
import at.sv.solcalc.SolarTimeOfDay;
import at.sv.solcalc.SunlightCalculator;
import at.sv.solcalc.SunlightChange;
import at.sv.solcalc.SunlightLevel;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Slf4j
public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final int MAX_CACHED_DATES = 366;

    private final SunlightCalculator calculator;
    private final double lat;
    private final double lng;
    private final ZoneId zone;

    private final Cache<LocalDate, List<SunlightChange>> cache;

    public SunTimesProviderImpl(SunlightCalculator calculator, double lat, double lng, ZoneId zone) {
        this.calculator = calculator;
        this.lat = lat;
        this.lng = lng;
        this.zone = zone;
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DATES)
                        .build();
    }

    @Override
    public List<SunlightChange> getSunlightChanges(LocalDate date) {
        return cache.get(date, this::calculateSunlightChanges);
    }

    private List<SunlightChange> calculateSunlightChanges(LocalDate date) {
        log.debug("Calculating sunlight changes for {} at {}, {}", date, lat, lng);
        return List.copyOf(calculator.getSunlightChangesOn(date, zone, lat, lng));
    }

    @Override
    public ZonedDateTime getNoon(LocalDate date) {
        return SolarCalculator.getSolarNoon(date, zone, lng);
    }

    @Override
    public List<ZonedDateTime> getTimes(SolarTimeOfDay timeOfDay, LocalDate date) {
        return timesOf(date, change -> change.name() == timeOfDay);
    }

    @Override
    public List<ZonedDateTime> getBeginnings(SunlightLevel level, LocalDate date) {
        return timesOf(date, change -> change.getNewSunlightLevel() == level);
    }

    @Override
    public List<ZonedDateTime> getEnds(SunlightLevel level, LocalDate date) {
        return timesOf(date, change -> change.getPreviousSunlightLevel() == level);
    }

    @Override
    public List<SunlightChange> getRisingIntoOrSettingOutOf(SunlightLevel level, LocalDate date) {
        return getSunlightChanges(date).stream()
                                       .filter(change -> change.isSunRising()
                                               ? change.getNewSunlightLevel() == level
                                               : change.getPreviousSunlightLevel() == level)
                                       .collect(Collectors.toList());
    }

    private List<ZonedDateTime> timesOf(LocalDate date, Predicate<SunlightChange> filter) {
        return getSunlightChanges(date).stream()
                                       .filter(filter)
                                       .map(SunlightChange::time)
                                       .collect(Collectors.toList());
    }

    @Override
    public String toDebugString(LocalDate date) {
        List<NamedTime> times = new ArrayList<>();
        getSunlightChanges(date).forEach(change -> times.add(new NamedTime(format(change.name()), change.time())));
        times.add(new NamedTime("noon", getNoon(date)));
        times.sort(Comparator.comparing(NamedTime::time));
        return times.stream()
                    .map(namedTime -> namedTime.name() + ": " + TIME_FORMATTER.format(namedTime.time()))
                    .collect(Collectors.joining("\n"));
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    private static String format(SolarTimeOfDay timeOfDay) {
        return timeOfDay.name().toLowerCase(Locale.ROOT);
    }

    private record NamedTime(String name, ZonedDateTime time) {
    }
}
