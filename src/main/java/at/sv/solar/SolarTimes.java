package at.sv.solar;

import at.sv.solar.time.InvalidStartTimeExpression;
import at.sv.solar.time.StartTimeProvider;
import at.sv.solar.time.StartTimeProviderImpl;
import at.sv.solar.time.SunTimesProvider;
import at.sv.solar.time.SunTimesProviderImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(name = "SolarTimes", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the UTC times of solar noon, sunrise, sunset and the civil, nautical and " +
                      "astronomical twilight for a location.")
public final class SolarTimes implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SolarTimes.class);

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
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:SUN_DATE}",
            description = "The UTC date to compute the sun times for. Default: today (UTC).")
    LocalDate date;
    @Option(names = "--days", paramLabel = "<days>",
            defaultValue = "1",
            description = "The number of consecutive days to print, starting at --date. Default: ${DEFAULT-VALUE}.")
    int days;
    @Option(names = "--at", paramLabel = "<expression>",
            description = "Resolves the given start time expression for each day, e.g. 'sunset+30', " +
                          "'civil_dawn-15' or '07:30'. Can be repeated.")
    List<String> expressions = new ArrayList<>();
    @Option(names = "--json",
            description = "Prints the sun times as JSON.")
    boolean json;
    @Option(names = "--epoch",
            description = "Prints the sun times as UTC epoch seconds, using " + EpochSunTimes.DOES_NOT_OCCUR +
                          " for events that do not occur.")
    boolean epoch;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        int execute = new CommandLine(new SolarTimes()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        assertConfigurationParameters();
        LocalDate start = date != null ? date : LocalDate.now(ZoneOffset.UTC);
        SunTimesProvider sunTimesProvider = new SunTimesProviderImpl(latitude, longitude);
        StartTimeProvider startTimeProvider = new StartTimeProviderImpl(sunTimesProvider);
        LOG.debug("Computing sun times for {} day(s) starting {} at lat={}, long={}", days, start, latitude, longitude);

        List<Map<String, Object>> reports = new ArrayList<>();
        PrintWriter out = spec.commandLine().getOut();
        for (int i = 0; i < days; i++) {
            LocalDate day = start.plusDays(i);
            SunTimes sunTimes = sunTimesProvider.getSunTimes(day);
            if (LOG.isTraceEnabled()) {
                LOG.trace("Sun times for {}:\n{}", day, sunTimesProvider.toDebugString(day));
            }
            Map<String, String> resolved = resolveExpressions(startTimeProvider, day);
            if (json) {
                reports.add(createReport(sunTimes, resolved));
            } else {
                printText(out, sunTimes, resolved, i > 0);
            }
        }
        if (json) {
            out.println(toJson(reports));
        }
        out.flush();
    }

    private Map<String, String> resolveExpressions(StartTimeProvider startTimeProvider, LocalDate day) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String expression : expressions) {
            try {
                resolved.put(expression, json
                        ? FormatUtil.formatIso(startTimeProvider.getStart(expression, day))
                        : FormatUtil.formatTime(startTimeProvider.getStart(expression, day), day));
            } catch (InvalidStartTimeExpression e) {
                throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }
        return resolved;
    }

    private void printText(PrintWriter out, SunTimes sunTimes, Map<String, String> resolved, boolean separator) {
        if (separator) {
            out.println();
        }
        out.println("==== " + sunTimes.date() + " (UTC) ====");
        if (epoch) {
            out.println(EpochSunTimes.from(sunTimes));
        } else {
            for (SunEvent event : SunEvent.values()) {
                out.println(event.getKeyword() + ": " + FormatUtil.formatTime(sunTimes.get(event), sunTimes.date()));
            }
        }
        resolved.forEach((expression, time) -> out.println(expression + ": " + time));
    }

    private Map<String, Object> createReport(SunTimes sunTimes, Map<String, String> resolved) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("date", sunTimes.date().toString());
        if (epoch) {
            report.put("epoch", EpochSunTimes.from(sunTimes));
        } else {
            for (SunEvent event : SunEvent.values()) {
                report.put(event.getKeyword(), FormatUtil.formatIso(sunTimes.get(event)));
            }
        }
        if (!resolved.isEmpty()) {
            report.put("resolved", resolved);
        }
        return report;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sun times", e);
        }
    }

    private void assertConfigurationParameters() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (days < 1) {
            fail("--days must be >= 1");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
