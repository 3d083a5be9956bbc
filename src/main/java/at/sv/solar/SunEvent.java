package at.sv.solar;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * All sun events of a day in chronological order (for non-polar locations), with the keywords used to reference them.
 */
public enum SunEvent {
    ASTRONOMICAL_DAWN(ElevationEvent.ASTRONOMICAL_DAWN, "astronomical_dawn", "astronomical_start"),
    NAUTICAL_DAWN(ElevationEvent.NAUTICAL_DAWN, "nautical_dawn", "nautical_start"),
    CIVIL_DAWN(ElevationEvent.CIVIL_DAWN, "civil_dawn", "civil_start"),
    SUNRISE(ElevationEvent.SUNRISE, "sunrise"),
    NOON(null, "noon"),
    SUNSET(ElevationEvent.SUNSET, "sunset"),
    CIVIL_DUSK(ElevationEvent.CIVIL_DUSK, "civil_dusk", "civil_end"),
    NAUTICAL_DUSK(ElevationEvent.NAUTICAL_DUSK, "nautical_dusk", "nautical_end"),
    ASTRONOMICAL_DUSK(ElevationEvent.ASTRONOMICAL_DUSK, "astronomical_dusk", "astronomical_end"),
    MIDNIGHT(null, "midnight");

    private final ElevationEvent elevationEvent;
    private final List<String> keywords;

    SunEvent(ElevationEvent elevationEvent, String... keywords) {
        this.elevationEvent = elevationEvent;
        this.keywords = List.of(keywords);
    }

    /**
     * @return the elevation event backing this sun event, empty for noon and midnight which always occur
     */
    public Optional<ElevationEvent> getElevationEvent() {
        return Optional.ofNullable(elevationEvent);
    }

    public String getKeyword() {
        return keywords.get(0);
    }

    public static Optional<SunEvent> fromKeyword(String keyword) {
        String normalized = keyword.trim().toLowerCase(Locale.ENGLISH);
        return Arrays.stream(values())
                     .filter(event -> event.keywords.contains(normalized))
                     .findFirst();
    }
}
