package at.sv.solcalc;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Iterator;

/**
 * Endless, forward-only sequence of sunlight changes at one place. Each change is only calculated when requested,
 * starting the search just after the previous one. There is always a next change, so consumers have to limit what
 * they take themselves.
 */
public final class SunlightChangeIterator implements Iterator<SunlightChange> {

    private final SunlightChangeFinder finder;
    private final double latitude;
    private final double longitude;
    private final Duration padding;
    private ZonedDateTime nextStart;

    SunlightChangeIterator(SunlightChangeFinder finder, ZonedDateTime start, double latitude, double longitude,
                           Duration padding) {
        this.finder = finder;
        this.nextStart = start;
        this.latitude = latitude;
        this.longitude = longitude;
        this.padding = padding;
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    /**
     * @throws SunlightChangeNotFound if the sunlight level does not change anymore within the configured search range
     */
    @Override
    public SunlightChange next() {
        SunlightChange change = finder.findNext(nextStart, latitude, longitude);
        nextStart = change.time().plus(padding);
        return change;
    }
}
