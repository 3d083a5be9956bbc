package at.sv.solar.astro;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * A (possibly fractional) number of days, either counted from the Julian epoch or used as a day offset.
 */
public record JulianDay(double days) {

    /**
     * Julian day number of the Unix epoch, 1970-01-01T00:00Z.
     */
    public static final double UNIX_EPOCH = 2440587.5;

    /**
     * Julian day number of the J2000.0 epoch, 2000-01-01T12:00Z.
     */
    public static final JulianDay J2000 = new JulianDay(2451545.0);

    private static final double SECONDS_PER_DAY = 86400.0;

    /**
     * @return the julian day number of the given date at UTC midnight
     */
    public static JulianDay fromDate(LocalDate date) {
        long epochSecond = date.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        return new JulianDay(epochSecond / SECONDS_PER_DAY + UNIX_EPOCH);
    }

    /**
     * Interprets the given angle as a fraction of a full day, i.e. 360° correspond to one day. Used to turn hour angles
     * and longitudes into day offsets.
     */
    public static JulianDay fromAngle(Angle angle) {
        return new JulianDay(angle.degrees() / 360.0);
    }

    public static JulianDay fromCentury(JulianCentury century) {
        return new JulianDay(century.centuries() * JulianCentury.DAYS_PER_CENTURY);
    }

    public JulianCentury toCentury() {
        return JulianCentury.fromDay(this);
    }

    public boolean isNaN() {
        return Double.isNaN(days);
    }

    /**
     * Converts this day count to whole seconds, flooring any sub-second remainder. Flooring (not truncation) keeps
     * negative offsets on the earlier second.
     *
     * @throws ArithmeticException if this value is not finite
     */
    public Duration toDuration() {
        if (!Double.isFinite(days)) {
            throw new ArithmeticException("Cannot convert non-finite julian day '" + days + "' to a duration");
        }
        return Duration.ofSeconds((long) Math.floor(days * SECONDS_PER_DAY));
    }
}
