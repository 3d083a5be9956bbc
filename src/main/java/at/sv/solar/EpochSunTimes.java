package at.sv.solar;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Flat representation of {@link SunTimes} as UTC epoch seconds, for callers that cannot handle optional values.
 * Events that do not occur are encoded as {@link #DOES_NOT_OCCUR}.
 */
public record EpochSunTimes(long noon, long midnight,
                            long astronomicalDawn, long nauticalDawn, long civilDawn, long sunrise,
                            long sunset, long civilDusk, long nauticalDusk, long astronomicalDusk) {

    /**
     * Sentinel for an event that does not occur, which is the Unix epoch itself.
     */
    public static final long DOES_NOT_OCCUR = 0L;

    public static EpochSunTimes from(SunTimes times) {
        return new EpochSunTimes(
                times.noon().toEpochSecond(),
                times.midnight().toEpochSecond(),
                epochSecond(times.astronomicalDawn()),
                epochSecond(times.nauticalDawn()),
                epochSecond(times.civilDawn()),
                epochSecond(times.sunrise()),
                epochSecond(times.sunset()),
                epochSecond(times.civilDusk()),
                epochSecond(times.nauticalDusk()),
                epochSecond(times.astronomicalDusk()));
    }

    private static long epochSecond(Optional<ZonedDateTime> time) {
        return time.map(ZonedDateTime::toEpochSecond).orElse(DOES_NOT_OCCUR);
    }
}
