package at.sv.solar;

/**
 * Elevation thresholds of the sun's center for the different sun events, in degrees above the horizon.
 */
public enum Twilight {
    ASTRONOMICAL(-18.0),
    NAUTICAL(-12.0),
    CIVIL(-6.0),
    /**
     * Upper edge of the disc touching the horizon, including atmospheric refraction.
     */
    VISUAL(-0.833);

    private final double elevation;

    Twilight(double elevation) {
        this.elevation = elevation;
    }

    public double getElevation() {
        return elevation;
    }
}
