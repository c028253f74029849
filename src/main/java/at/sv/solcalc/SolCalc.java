package at.sv.solcalc;

import at.sv.solcalc.time.SunTimesProvider;
import at.sv.solcalc.time.SunTimesProviderImpl;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.function.Supplier;

@Command(name = "solcalc", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the sunlight level and the solar position at a place, the next sunlight change, " +
                      "and all sun times of a day.")
public final class SolCalc implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SolCalc.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone of your location, e.g. 'Europe/Vienna'. It has to be the zone actually in effect " +
                          "at the given coordinates. Default: the system time zone.")
    ZoneId zone;
    @Option(names = "--at", paramLabel = "<yyyy-MM-ddTHH:mm[:ss]>",
            description = "The local date time to calculate the sunlight for. Default: now.")
    LocalDateTime at;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The date to list the sun times for. Default: the date of --at.")
    LocalDate date;
    @Option(names = "--precision", paramLabel = "<degrees>",
            defaultValue = "${env:ELEVATION_PRECISION:-0.0001}",
            description = "The maximum difference in degrees between the solar elevation at a calculated change and " +
                          "the elevation defining it. Default: ${DEFAULT-VALUE}")
    BigDecimal precision;
    @Option(names = "--max-iterations", paramLabel = "<iterations>",
            defaultValue = "${env:MAX_ITERATIONS:-50}",
            description = "The maximum number of refinement steps per sunlight change. " +
                          "If reached, the best estimate is used. Default: ${DEFAULT-VALUE}")
    int maxIterations;
    @Option(names = "--json",
            description = "Print the result as JSON.")
    boolean json;

    private final ObjectMapper mapper;
    private Supplier<ZonedDateTime> currentTime;

    public SolCalc() {
        currentTime = ZonedDateTime::now;
        mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SolCalc(Supplier<ZonedDateTime> currentTime) {
        this();
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SolCalc()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZonedDateTime time = getTime();
        LocalDate day = date != null ? date : time.toLocalDate();
        SunlightCalculator calculator = new SunlightCalculator(SunlightCalculationSettings.builder()
                                                                                          .elevationPrecision(precision)
                                                                                          .maxIterations(maxIterations)
                                                                                          .build());
        SunTimesProvider sunTimes = new SunTimesProviderImpl(calculator, latitude, longitude, time.getZone());
        LOG.debug("Calculating sunlight at {} for {}, {}", time, latitude, longitude);

        MDC.put("context", "calculation");
        SolarPosition position = SolarCalculator.getSolarPosition(time, latitude, longitude);
        SunlightLevel level = SunlightLevel.forSolarElevation(position.elevation());
        SunlightChange nextChange = calculator.getNextSunlightChange(time, latitude, longitude);

        PrintWriter out = getOut();
        if (json) {
            out.println(toJson(SunlightReport.of(time, latitude, longitude, level, position, nextChange,
                    sunTimes.getNoon(day), sunTimes.getSunlightChanges(day))));
        } else {
            out.println("Sunlight at " + time.withNano(0) + ": " + level);
            out.println("Solar position: azimuth " + formatAngle(position.azimuth()) +
                        ", elevation " + formatAngle(position.elevation()) +
                        ", declination " + formatAngle(position.declination()));
            out.println("Next change: " + nextChange);
            out.println("Sun times on " + day + ":");
            out.println(sunTimes.toDebugString(day));
        }
        out.flush();
        MDC.remove("context");
    }

    private ZonedDateTime getTime() {
        ZonedDateTime now = currentTime.get();
        ZoneId effectiveZone = zone != null ? zone : now.getZone();
        if (at != null) {
            return at.atZone(effectiveZone);
        }
        return now.withZoneSameInstant(effectiveZone);
    }

    private String toJson(SunlightReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationFailure("Failed to serialize report", e);
        }
    }

    private static String formatAngle(BigDecimal angle) {
        return angle.setScale(2, RoundingMode.HALF_EVEN).toPlainString() + "°";
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out, true);
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertCalculationConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertCalculationConfigurations() {
        if (precision == null || precision.signum() <= 0) {
            fail("--precision must be > 0");
        }
        if (maxIterations <= 0) {
            fail("--max-iterations must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
