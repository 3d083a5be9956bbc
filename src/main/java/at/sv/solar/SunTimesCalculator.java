package at.sv.solar;

import at.sv.solar.astro.Angle;
import at.sv.solar.astro.JulianCentury;
import at.sv.solar.astro.JulianDay;
import at.sv.solar.astro.SolarEventSolver;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the sun events of a UTC date for a location. Latitude and longitude are in degrees, north and east
 * positive, and are not validated.
 * <p>
 * Event times are relative to the UTC midnight of the given date and may fall on the previous or next UTC day for
 * locations far from the prime meridian.
 */
public final class SunTimesCalculator {

    private static final Duration HALF_DAY = Duration.ofHours(12);

    private SunTimesCalculator() {
    }

    public static SunTimes calculate(double latitude, double longitude, LocalDate date) {
        DayBaseline baseline = DayBaseline.of(longitude, date);
        Angle lat = Angle.ofDegrees(latitude);
        Map<ElevationEvent, ZonedDateTime> events = new EnumMap<>(ElevationEvent.class);
        for (ElevationEvent event : ElevationEvent.values()) {
            baseline.timeOf(lat, event).ifPresent(time -> events.put(event, time));
        }
        return new SunTimes(date, baseline.noon(), baseline.midnight(), events);
    }

    public static Optional<ZonedDateTime> calculate(double latitude, double longitude, LocalDate date, SunEvent event) {
        DayBaseline baseline = DayBaseline.of(longitude, date);
        return switch (event) {
            case NOON -> Optional.of(baseline.noon());
            case MIDNIGHT -> Optional.of(baseline.midnight());
            default -> event.getElevationEvent().flatMap(e -> baseline.timeOf(Angle.ofDegrees(latitude), e));
        };
    }

    /**
     * Computes the sun events for the UTC date containing the given epoch second, encoded as flat epoch seconds.
     */
    public static EpochSunTimes calculateEpoch(double latitude, double longitude, long epochSecond) {
        LocalDate date = LocalDate.ofInstant(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
        return EpochSunTimes.from(calculate(latitude, longitude, date));
    }

    /**
     * The UTC midnight of a day, together with its solar noon, from which all event offsets are computed.
     */
    private record DayBaseline(ZonedDateTime utcMidnight, Angle longitude, JulianCentury noonCentury,
                               ZonedDateTime noon) {

        static DayBaseline of(double longitude, LocalDate date) {
            Angle lon = Angle.ofDegrees(longitude);
            JulianCentury day = JulianCentury.fromDate(date).minus(JulianDay.J2000);
            JulianDay noonOffset = SolarEventSolver.timeOfSolarNoon(day, lon);
            ZonedDateTime utcMidnight = date.atStartOfDay(ZoneOffset.UTC);
            return new DayBaseline(utcMidnight, lon, day.plus(noonOffset), utcMidnight.plus(noonOffset.toDuration()));
        }

        ZonedDateTime midnight() {
            return noon.plus(HALF_DAY);
        }

        Optional<ZonedDateTime> timeOf(Angle latitude, ElevationEvent event) {
            JulianDay offset = SolarEventSolver.timeOfSolarElevation(noonCentury, latitude, longitude,
                    event.zenithAngle());
            if (offset.isNaN()) {
                return Optional.empty();
            }
            return Optional.of(utcMidnight.plus(offset.toDuration()));
        }
    }
}
