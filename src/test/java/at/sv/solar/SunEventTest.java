package at.sv.solar;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SunEventTest {

    @Test
    void fromKeyword_primaryKeywords() {
        for (SunEvent event : SunEvent.values()) {
            assertThat(SunEvent.fromKeyword(event.getKeyword())).contains(event);
        }
    }

    @Test
    void fromKeyword_aliases_caseInsensitive() {
        assertThat(SunEvent.fromKeyword("astronomical_start")).contains(SunEvent.ASTRONOMICAL_DAWN);
        assertThat(SunEvent.fromKeyword("NAUTICAL_END")).contains(SunEvent.NAUTICAL_DUSK);
        assertThat(SunEvent.fromKeyword(" Civil_Start ")).contains(SunEvent.CIVIL_DAWN);
        assertThat(SunEvent.fromKeyword("SunSet")).contains(SunEvent.SUNSET);
    }

    @Test
    void fromKeyword_unknown_empty() {
        assertThat(SunEvent.fromKeyword("golden_hour")).isEmpty();
        assertThat(SunEvent.fromKeyword("")).isEmpty();
    }

    @Test
    void noonAndMidnight_haveNoElevationEvent() {
        assertThat(SunEvent.NOON.getElevationEvent()).isEmpty();
        assertThat(SunEvent.MIDNIGHT.getElevationEvent()).isEmpty();
    }

    @Test
    void everyElevationEventIsReferencedExactlyOnce() {
        for (ElevationEvent elevationEvent : ElevationEvent.values()) {
            long references = Arrays.stream(SunEvent.values())
                                    .map(SunEvent::getElevationEvent)
                                    .filter(e -> e.equals(Optional.of(elevationEvent)))
                                    .count();

            assertThat(references).as(elevationEvent.name()).isEqualTo(1);
        }
    }
}
