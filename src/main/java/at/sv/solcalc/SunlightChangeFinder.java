package at.sv.solcalc;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZonedDateTime;

import static at.sv.solcalc.math.DecimalMath.CONTEXT;
import static at.sv.solcalc.math.DecimalMath.PI;
import static at.sv.solcalc.math.DecimalMath.asin;
import static at.sv.solcalc.math.DecimalMath.sqrt;

/**
 * Finds the next instant at which the sunlight level at a place changes.
 * <p>
 * The day is split into half-days between the sun's turning points, its highest point near solar noon and its lowest
 * point near solar midnight. Within a half-day the elevation only rises or only falls, roughly like a sine. The
 * crossing of the target elevation is first estimated from that shape and then refined with Newton's method, kept
 * within the part of the half-day known to contain the crossing. Half-days in which the current level persists (polar
 * day, night or twilight) are skipped one at a time.
 */
@Slf4j
final class SunlightChangeFinder {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal MAX_STEP_SECONDS = BigDecimal.valueOf(12 * 60 * 60);
    private static final long CURVE_SAMPLE_SECONDS = 20 * 60;
    private static final BigDecimal MAX_TURNING_POINT_SHIFT_SECONDS = BigDecimal.valueOf(3 * 60 * 60);

    private final SunlightCalculationSettings settings;

    SunlightChangeFinder(SunlightCalculationSettings settings) {
        this.settings = settings;
    }

    SunlightChange findNext(ZonedDateTime start, double latitude, double longitude) {
        HalfDay halfDay = HalfDay.containing(start, new Place(latitude, longitude));
        for (int skipped = 0; skipped <= settings.getMaxSkippedHalfDays(); skipped++) {
            if (halfDay.isTargetReachable()) {
                return refine(halfDay);
            }
            log.debug("No {} before {}, {} persists at elevation {}", halfDay.target, halfDay.end.time(),
                    halfDay.level, halfDay.end.elevation());
            halfDay = halfDay.next();
        }
        throw new SunlightChangeNotFound("No sunlight change within " + settings.getMaxSkippedHalfDays() +
                                         " half-days after " + start + " at " + latitude + ", " + longitude);
    }

    private SunlightChange refine(HalfDay halfDay) {
        BigDecimal desired = halfDay.desiredElevation();
        ZonedDateTime before = halfDay.start;
        ZonedDateTime after = halfDay.end.time();
        ZonedDateTime estimate = withinBracket(halfDay.estimate(), before, after);
        BigDecimal elevation = halfDay.place.elevationAt(estimate);
        for (int iteration = 1; iteration < settings.getMaxIterations(); iteration++) {
            if (isPreciseEnough(elevation, desired)) {
                return new SunlightChange(estimate, halfDay.target);
            }
            if (halfDay.hasReached(elevation)) {
                after = estimate;
            } else {
                before = estimate;
            }
            BigDecimal rateOfChange = halfDay.place.elevationAt(estimate.plusSeconds(1)).subtract(elevation, CONTEXT);
            ZonedDateTime newtonEstimate = null;
            if (rateOfChange.signum() != 0) {
                BigDecimal stepSeconds = desired.subtract(elevation, CONTEXT).divide(rateOfChange, CONTEXT);
                newtonEstimate = estimate.plus(TimeUtil.durationOfSeconds(limitStep(stepSeconds)));
            }
            estimate = withinBracket(newtonEstimate, before, after);
            elevation = halfDay.place.elevationAt(estimate);
            log.trace("{} iteration {}: {} at {}", halfDay.target, iteration, elevation, estimate);
        }
        if (!isPreciseEnough(elevation, desired)) {
            log.warn("{} did not converge within {} iterations, returning {} with residual {}", halfDay.target,
                    settings.getMaxIterations(), estimate, elevation.subtract(desired, CONTEXT));
        }
        return new SunlightChange(estimate, halfDay.target);
    }

    /**
     * @return the candidate if it lies strictly between both instants, otherwise their midpoint
     */
    static ZonedDateTime withinBracket(ZonedDateTime candidate, ZonedDateTime before, ZonedDateTime after) {
        if (candidate != null && candidate.isAfter(before) && candidate.isBefore(after)) {
            return candidate;
        }
        return before.plus(Duration.between(before, after).dividedBy(2));
    }

    private boolean isPreciseEnough(BigDecimal elevation, BigDecimal desired) {
        return elevation.subtract(desired, CONTEXT).abs().compareTo(settings.getElevationPrecision()) <= 0;
    }

    private static BigDecimal limitStep(BigDecimal stepSeconds) {
        return stepSeconds.max(MAX_STEP_SECONDS.negate()).min(MAX_STEP_SECONDS);
    }

    private record Place(double latitude, double longitude) {

        BigDecimal elevationAt(ZonedDateTime time) {
            return SolarCalculator.getSolarElevation(time, latitude, longitude);
        }

        /**
         * Moves the given noon or midnight to the vertex of a parabola through the elevations twenty minutes before,
         * at and after it. Stays at the noon or midnight if the elevation is not bent accordingly there.
         */
        TurningPoint turningPointNear(SolarExtremum extremum) {
            ZonedDateTime time = extremum.time();
            BigDecimal before = elevationAt(time.minusSeconds(CURVE_SAMPLE_SECONDS));
            BigDecimal at = elevationAt(time);
            BigDecimal after = elevationAt(time.plusSeconds(CURVE_SAMPLE_SECONDS));
            BigDecimal curvature = before.subtract(at.multiply(TWO, CONTEXT), CONTEXT).add(after, CONTEXT);
            if (extremum.noon() ? curvature.signum() >= 0 : curvature.signum() <= 0) {
                return new TurningPoint(extremum, time, at);
            }
            BigDecimal shiftSeconds = BigDecimal.valueOf(CURVE_SAMPLE_SECONDS)
                                                .multiply(before.subtract(after, CONTEXT), CONTEXT)
                                                .divide(TWO.multiply(curvature, CONTEXT), CONTEXT)
                                                .max(MAX_TURNING_POINT_SHIFT_SECONDS.negate())
                                                .min(MAX_TURNING_POINT_SHIFT_SECONDS);
            ZonedDateTime shifted = time.plus(TimeUtil.durationOfSeconds(shiftSeconds));
            BigDecimal shiftedElevation = elevationAt(shifted);
            int comparison = shiftedElevation.compareTo(at);
            if (extremum.noon() ? comparison > 0 : comparison < 0) {
                return new TurningPoint(extremum, shifted, shiftedElevation);
            }
            return new TurningPoint(extremum, time, at);
        }
    }

    /**
     * The sun's actual highest or lowest point near a solar noon or midnight.
     */
    private record TurningPoint(SolarExtremum extremum, ZonedDateTime time, BigDecimal elevation) {
    }

    /**
     * The part of a half-day from a search start to the half-day's closing turning point.
     */
    private static final class HalfDay {
        private final Place place;
        private final ZonedDateTime start;
        private final TurningPoint begin;
        private final TurningPoint end;
        private final boolean rising;
        private final SunlightLevel level;
        private final SolarTimeOfDay target;
        private final BigDecimal minElevation;
        private final BigDecimal maxElevation;

        private HalfDay(Place place, ZonedDateTime start, BigDecimal elevationAtStart, TurningPoint begin,
                        TurningPoint end) {
            this.place = place;
            this.start = start;
            this.begin = begin;
            this.end = end;
            int comparison = end.elevation().compareTo(begin.elevation());
            rising = comparison != 0 ? comparison > 0 : end.extremum().noon();
            level = SunlightLevel.forSolarElevation(elevationAtStart);
            target = level.getEnd(rising);
            minElevation = rising ? begin.elevation() : end.elevation();
            maxElevation = rising ? end.elevation() : begin.elevation();
        }

        static HalfDay containing(ZonedDateTime start, Place place) {
            SolarNoonsAndMidnights extrema = SolarNoonsAndMidnights.around(start, place.longitude());
            TurningPoint begin = place.turningPointNear(extrema.previousExtremum());
            TurningPoint end = place.turningPointNear(extrema.nextExtremum());
            if (start.isBefore(begin.time())) {
                end = begin;
                begin = place.turningPointNear(begin.extremum().previous(place.longitude()));
            } else if (!start.isBefore(end.time())) {
                begin = end;
                end = place.turningPointNear(end.extremum().next(place.longitude()));
            }
            return new HalfDay(place, start, place.elevationAt(start), begin, end);
        }

        HalfDay next() {
            TurningPoint following = place.turningPointNear(end.extremum().next(place.longitude()));
            return new HalfDay(place, end.time(), end.elevation(), end, following);
        }

        BigDecimal desiredElevation() {
            return target.getSolarElevation();
        }

        /**
         * Daylight cannot end while the sun rises, and night cannot end while it sets.
         */
        boolean isTargetReachable() {
            return target.isSunRising() == rising && hasReached(end.elevation());
        }

        boolean hasReached(BigDecimal elevation) {
            int comparison = elevation.compareTo(desiredElevation());
            return rising ? comparison >= 0 : comparison < 0;
        }

        /**
         * Inverts a sine shaped elevation curve between the half-day's turning points.
         */
        ZonedDateTime estimate() {
            BigDecimal range = maxElevation.subtract(minElevation, CONTEXT);
            if (range.signum() == 0) {
                return null;
            }
            BigDecimal elevationRatio = desiredElevation().subtract(minElevation, CONTEXT)
                                                          .divide(range, CONTEXT)
                                                          .max(BigDecimal.ZERO)
                                                          .min(BigDecimal.ONE);
            BigDecimal timeRatio = TWO.multiply(asin(sqrt(elevationRatio)), CONTEXT).divide(PI, CONTEXT);
            if (!rising) {
                timeRatio = BigDecimal.ONE.subtract(timeRatio, CONTEXT);
            }
            ZonedDateTime from = begin.time();
            return from.plus(TimeUtil.scale(Duration.between(from, end.time()), timeRatio));
        }
    }
}
