package at.sv.solcalc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZonedDateTime;

import static at.sv.solcalc.math.DecimalMath.CONTEXT;

public final class TimeUtil {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);
    private static final BigDecimal NANOS_PER_MINUTE = BigDecimal.valueOf(60_000_000_000L);
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private TimeUtil() {
    }

    public static Duration durationOfMinutes(BigDecimal minutes) {
        return Duration.ofNanos(minutes.multiply(NANOS_PER_MINUTE, CONTEXT).setScale(0, RoundingMode.HALF_EVEN).longValueExact());
    }

    public static Duration durationOfSeconds(BigDecimal seconds) {
        return Duration.ofNanos(seconds.multiply(NANOS_PER_SECOND, CONTEXT).setScale(0, RoundingMode.HALF_EVEN).longValueExact());
    }

    /**
     * Scales the given duration by the given factor, rounded to the nanosecond.
     */
    public static Duration scale(Duration duration, BigDecimal factor) {
        BigDecimal nanos = BigDecimal.valueOf(duration.toNanos()).multiply(factor, CONTEXT);
        return Duration.ofNanos(nanos.setScale(0, RoundingMode.HALF_EVEN).longValueExact());
    }

    public static BigDecimal minutesSinceStartOfDay(ZonedDateTime dateTime) {
        return BigDecimal.valueOf(dateTime.toLocalTime().toNanoOfDay()).divide(NANOS_PER_MINUTE, CONTEXT);
    }

    public static BigDecimal offsetHours(ZonedDateTime dateTime) {
        return BigDecimal.valueOf(dateTime.getOffset().getTotalSeconds()).divide(SECONDS_PER_HOUR, CONTEXT);
    }
}
