package at.sv.solar.astro;

import java.time.LocalDate;

/**
 * A number of Julian centuries of 36525 days. This is the time parameter of the solar position polynomials.
 * <p>
 * Arithmetic with a {@link JulianDay} operand converts the day value first, the result is always a century.
 */
public record JulianCentury(double centuries) {

    public static final double DAYS_PER_CENTURY = 36525.0;

    public static JulianCentury fromDay(JulianDay day) {
        return new JulianCentury(day.days() / DAYS_PER_CENTURY);
    }

    /**
     * @return the julian century of the given date at UTC midnight, counted from the Julian epoch
     */
    public static JulianCentury fromDate(LocalDate date) {
        return fromDay(JulianDay.fromDate(date));
    }

    public JulianDay toDay() {
        return JulianDay.fromCentury(this);
    }

    public JulianCentury plus(JulianCentury other) {
        return new JulianCentury(centuries + other.centuries);
    }

    public JulianCentury plus(JulianDay days) {
        return new JulianCentury(centuries + fromDay(days).centuries);
    }

    public JulianCentury minus(JulianCentury other) {
        return new JulianCentury(centuries - other.centuries);
    }

    public JulianCentury minus(JulianDay days) {
        return new JulianCentury(centuries - fromDay(days).centuries);
    }
}
