package at.sv.solar.astro;

/**
 * Position of the sun for a given time, using the polynomial approximations of the NOAA solar calculator
 * (Jean Meeus, Astronomical Algorithms). All methods take the time as julian centuries since J2000.0.
 * <p>
 * Accuracy is in the range of a minute for dates within a few hundred years of 2000.
 */
final class SolarPosition {

    private SolarPosition() {
    }

    /**
     * The modulo only applies to the time dependent term, not to the 280.46646° constant. The result is therefore not
     * within [0°, 360°) and is only meant to be consumed by sin/cos.
     */
    static Angle geometricMeanLongitude(JulianCentury tp) {
        double t = tp.centuries();
        return Angle.ofDegrees(280.46646 + t * (36000.76983 + t * 0.0003032) % 360.0);
    }

    static Angle geometricMeanAnomaly(JulianCentury tp) {
        double t = tp.centuries();
        return Angle.ofDegrees(357.52911 + t * (35999.05029 - 0.0001537 * t));
    }

    static double earthOrbitEccentricity(JulianCentury tp) {
        double t = tp.centuries();
        return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
    }

    static Angle equationOfCenter(JulianCentury tp) {
        Angle anomaly = geometricMeanAnomaly(tp);
        double t = tp.centuries();
        return Angle.ofDegrees(anomaly.sin() * (1.914602 - t * (0.004817 + 0.000014 * t))
                               + Angle.times(2.0, anomaly).sin() * (0.019993 - 0.000101 * t)
                               + Angle.times(3.0, anomaly).sin() * 0.000289);
    }

    static Angle trueLongitude(JulianCentury tp) {
        return geometricMeanLongitude(tp).plus(equationOfCenter(tp));
    }

    static Angle apparentLongitude(JulianCentury tp) {
        return trueLongitude(tp).minus(Angle.ofDegrees(0.00569 + 0.00478 * ascendingNode(tp).sin()));
    }

    static Angle meanObliquityOfEcliptic(JulianCentury tp) {
        double t = tp.centuries();
        double seconds = 21.448 - t * (46.815 + t * (0.00059 - t * 0.001813));
        return Angle.ofDegrees(23.0 + (26.0 + seconds / 60.0) / 60.0);
    }

    static Angle obliquityCorrection(JulianCentury tp) {
        return meanObliquityOfEcliptic(tp).plus(Angle.ofDegrees(0.00256 * ascendingNode(tp).cos()));
    }

    static Angle declination(JulianCentury tp) {
        Angle apparentLongitude = apparentLongitude(tp);
        Angle obliquity = obliquityCorrection(tp);
        return Angle.ofRadians(Math.asin(obliquity.sin() * apparentLongitude.sin()));
    }

    /**
     * @return the equation of time as an angle, where a full turn corresponds to one day
     */
    static Angle equationOfTime(JulianCentury tp) {
        Angle obliquity = obliquityCorrection(tp);
        Angle meanLongitude = geometricMeanLongitude(tp);
        Angle meanAnomaly = geometricMeanAnomaly(tp);
        double e = earthOrbitEccentricity(tp);
        double y = obliquity.dividedBy(2.0).tan() * obliquity.dividedBy(2.0).tan();

        double eqTime = y * Angle.times(2.0, meanLongitude).sin()
                        - 2.0 * e * meanAnomaly.sin()
                        + 4.0 * e * y * meanAnomaly.sin() * Angle.times(2.0, meanLongitude).cos()
                        - 0.5 * y * y * Angle.times(4.0, meanLongitude).sin()
                        - 1.25 * e * e * Angle.times(2.0, meanAnomaly).sin();
        return Angle.ofRadians(eqTime);
    }

    // longitude of the moon's ascending node, drives nutation and aberration corrections
    private static Angle ascendingNode(JulianCentury tp) {
        return Angle.ofDegrees(125.04 - 1934.136 * tp.centuries());
    }
}
