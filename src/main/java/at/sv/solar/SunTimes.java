package at.sv.solar;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The UTC times of all sun events for a date. Noon and midnight always occur, elevation events might not, e.g. during
 * polar day or polar night.
 */
public record SunTimes(LocalDate date, ZonedDateTime noon, ZonedDateTime midnight,
                       Map<ElevationEvent, ZonedDateTime> elevationEvents) {

    public SunTimes {
        EnumMap<ElevationEvent, ZonedDateTime> copy = new EnumMap<>(ElevationEvent.class);
        copy.putAll(elevationEvents);
        elevationEvents = Collections.unmodifiableMap(copy);
    }

    public Optional<ZonedDateTime> get(ElevationEvent event) {
        return Optional.ofNullable(elevationEvents.get(event));
    }

    public Optional<ZonedDateTime> get(SunEvent event) {
        return switch (event) {
            case NOON -> Optional.of(noon);
            case MIDNIGHT -> Optional.of(midnight);
            default -> event.getElevationEvent().flatMap(this::get);
        };
    }

    public Optional<ZonedDateTime> astronomicalDawn() {
        return get(ElevationEvent.ASTRONOMICAL_DAWN);
    }

    public Optional<ZonedDateTime> nauticalDawn() {
        return get(ElevationEvent.NAUTICAL_DAWN);
    }

    public Optional<ZonedDateTime> civilDawn() {
        return get(ElevationEvent.CIVIL_DAWN);
    }

    public Optional<ZonedDateTime> sunrise() {
        return get(ElevationEvent.SUNRISE);
    }

    public Optional<ZonedDateTime> sunset() {
        return get(ElevationEvent.SUNSET);
    }

    public Optional<ZonedDateTime> civilDusk() {
        return get(ElevationEvent.CIVIL_DUSK);
    }

    public Optional<ZonedDateTime> nauticalDusk() {
        return get(ElevationEvent.NAUTICAL_DUSK);
    }

    public Optional<ZonedDateTime> astronomicalDusk() {
        return get(ElevationEvent.ASTRONOMICAL_DUSK);
    }
}
