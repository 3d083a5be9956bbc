package at.sv.solar;

import at.sv.solar.astro.Angle;

/**
 * The sun events defined by the sun crossing an elevation threshold, either rising (dawn side) or setting (dusk side).
 */
public enum ElevationEvent {
    ASTRONOMICAL_DAWN(Twilight.ASTRONOMICAL, Side.DAWN),
    NAUTICAL_DAWN(Twilight.NAUTICAL, Side.DAWN),
    CIVIL_DAWN(Twilight.CIVIL, Side.DAWN),
    SUNRISE(Twilight.VISUAL, Side.DAWN),
    SUNSET(Twilight.VISUAL, Side.DUSK),
    CIVIL_DUSK(Twilight.CIVIL, Side.DUSK),
    NAUTICAL_DUSK(Twilight.NAUTICAL, Side.DUSK),
    ASTRONOMICAL_DUSK(Twilight.ASTRONOMICAL, Side.DUSK);

    private final Twilight twilight;
    private final Side side;

    ElevationEvent(Twilight twilight, Side side) {
        this.twilight = twilight;
        this.side = side;
    }

    public Twilight getTwilight() {
        return twilight;
    }

    public Side getSide() {
        return side;
    }

    /**
     * @return the signed zenith angle handed to the solver: {@code -90° + elevation} on the dawn side,
     * {@code 90° - elevation} on the dusk side
     */
    public Angle zenithAngle() {
        return Angle.ofDegrees(side.sign * (90.0 - twilight.getElevation()));
    }

    public enum Side {
        DAWN(-1),
        DUSK(1);

        private final int sign;

        Side(int sign) {
            this.sign = sign;
        }
    }
}
