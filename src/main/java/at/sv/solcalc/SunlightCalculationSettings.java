package at.sv.solcalc;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tuning of the search for sunlight changes, see {@link SunlightCalculator}.
 */
@Getter
@ToString
@AllArgsConstructor
@Builder(toBuilder = true)
public final class SunlightCalculationSettings {

    public static final SunlightCalculationSettings DEFAULT = SunlightCalculationSettings.builder().build();

    /**
     * Maximum distance in degrees between the elevation at a returned change and the elevation defining it.
     */
    @Builder.Default
    private final BigDecimal elevationPrecision = new BigDecimal("0.0001");
    /**
     * Upper bound of Newton iterations per change. If reached, the best estimate so far is returned.
     */
    @Builder.Default
    private final int maxIterations = 50;
    /**
     * Gap between a found change and the start of the search for the one after it.
     */
    @Builder.Default
    private final Duration padding = Duration.ofMinutes(1);
    /**
     * How many half-days without any sunlight change are skipped before giving up.
     */
    @Builder.Default
    private final int maxSkippedHalfDays = 1000;

    void validate() {
        if (elevationPrecision == null || elevationPrecision.signum() <= 0) {
            throw new IllegalArgumentException("elevationPrecision must be > 0, but was " + elevationPrecision);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0, but was " + maxIterations);
        }
        if (padding == null || padding.isNegative() || padding.isZero()) {
            throw new IllegalArgumentException("padding must be positive, but was " + padding);
        }
        if (maxSkippedHalfDays < 0) {
            throw new IllegalArgumentException("maxSkippedHalfDays must be >= 0, but was " + maxSkippedHalfDays);
        }
    }
}
