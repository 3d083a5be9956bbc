package at.sv.solar.astro;

/**
 * Solves for the time of solar noon and for the time the sun passes a given elevation on a day.
 * <p>
 * Both solvers refine their first estimate in exactly two passes, independent of the input.
 * <p>
 * The elevation angle passed to {@link #timeOfSolarElevation} is the signed zenith angle of the event: negative for
 * events before noon (e.g. {@code -90° + (-0.833°)} for sunrise), positive for events after noon (e.g.
 * {@code 90° - (-0.833°)} for sunset). If the sun never reaches that elevation on the given day, the result is NaN.
 */
public final class SolarEventSolver {

    /**
     * Local solar noon expressed as an angle, half a turn after midnight.
     */
    private static final Angle NOON = Angle.ofRadians(Math.PI);

    private SolarEventSolver() {
    }

    /**
     * Computes the hour angle of the sun for the given signed zenith angle. The sign of the result is the sign of
     * {@code -elevation}, i.e. positive for events before noon.
     *
     * @return the hour angle, or NaN if the sun does not reach the elevation on that day
     */
    public static Angle hourAngle(JulianCentury tp, Angle latitude, Angle elevation) {
        Angle declination = SolarPosition.declination(tp);
        double omega = Math.acos(elevation.cos() / (latitude.cos() * declination.cos())
                                 - latitude.tan() * declination.tan());
        return Angle.ofRadians(Math.copySign(omega, -elevation.radians()));
    }

    /**
     * @param day       the UTC midnight of the day in julian centuries since J2000.0
     * @param longitude the observer longitude, east positive
     * @return the offset of solar noon from the given midnight
     */
    public static JulianDay timeOfSolarNoon(JulianCentury day, Angle longitude) {
        // approximate noon from the longitude alone
        JulianCentury tp = day.plus(JulianDay.fromAngle(NOON.minus(longitude)));

        Angle eqOfTime = SolarPosition.equationOfTime(tp);
        tp = day.plus(JulianDay.fromAngle(NOON.minus(longitude).minus(eqOfTime)));

        eqOfTime = SolarPosition.equationOfTime(tp);
        return JulianDay.fromAngle(NOON.minus(longitude).minus(eqOfTime));
    }

    /**
     * @param noon      the time of solar noon in julian centuries since J2000.0, see {@link #timeOfSolarNoon}
     * @param latitude  the observer latitude, north positive
     * @param longitude the observer longitude, east positive
     * @param elevation the signed zenith angle of the event
     * @return the offset of the event from the UTC midnight of the day, NaN if the event does not occur
     */
    public static JulianDay timeOfSolarElevation(JulianCentury noon, Angle latitude, Angle longitude, Angle elevation) {
        Angle angle = hourAngle(noon, latitude, elevation);
        JulianCentury tp = noon.minus(JulianDay.fromAngle(angle));

        // second pass at the estimated event time; a NaN hour angle carries through to the result
        Angle eqOfTime = SolarPosition.equationOfTime(tp);
        angle = hourAngle(tp, latitude, elevation);
        return JulianDay.fromAngle(NOON.minus(longitude).minus(eqOfTime).minus(angle));
    }
}
