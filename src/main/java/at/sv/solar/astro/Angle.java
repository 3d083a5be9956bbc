package at.sv.solar.astro;

/**
 * An angle backed by radians. Values are never normalized into [0, 2π), so accumulated offsets and negative angles
 * keep their meaning. NaN is a legal value and marks an angle that has no solution.
 */
public record Angle(double radians) {

    public static Angle ofRadians(double radians) {
        return new Angle(radians);
    }

    public static Angle ofDegrees(double degrees) {
        return new Angle(Math.toRadians(degrees));
    }

    public double degrees() {
        return Math.toDegrees(radians);
    }

    public double sin() {
        return Math.sin(radians);
    }

    public double cos() {
        return Math.cos(radians);
    }

    public double tan() {
        return Math.tan(radians);
    }

    public boolean isNaN() {
        return Double.isNaN(radians);
    }

    public Angle plus(Angle other) {
        return new Angle(radians + other.radians);
    }

    public Angle minus(Angle other) {
        return new Angle(radians - other.radians);
    }

    public Angle times(double factor) {
        return new Angle(radians * factor);
    }

    /**
     * Scalar first variant of {@link #times(double)}.
     */
    public static Angle times(double factor, Angle angle) {
        return new Angle(factor * angle.radians);
    }

    public Angle dividedBy(double divisor) {
        return new Angle(radians / divisor);
    }

    @Override
    public String toString() {
        return degrees() + "°";
    }
}
