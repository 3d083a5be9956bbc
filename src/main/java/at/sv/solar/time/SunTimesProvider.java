package at.sv.solar.time;

import at.sv.solar.SunTimes;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Provides the UTC sun event times of a location. Events that do not occur on a date are returned as empty.
 */
public interface SunTimesProvider {

    SunTimes getSunTimes(LocalDate date);

    default Optional<ZonedDateTime> getAstronomicalStart(LocalDate date) {
        return getSunTimes(date).astronomicalDawn();
    }

    default Optional<ZonedDateTime> getNauticalStart(LocalDate date) {
        return getSunTimes(date).nauticalDawn();
    }

    default Optional<ZonedDateTime> getCivilStart(LocalDate date) {
        return getSunTimes(date).civilDawn();
    }

    default Optional<ZonedDateTime> getSunrise(LocalDate date) {
        return getSunTimes(date).sunrise();
    }

    default ZonedDateTime getNoon(LocalDate date) {
        return getSunTimes(date).noon();
    }

    default Optional<ZonedDateTime> getSunset(LocalDate date) {
        return getSunTimes(date).sunset();
    }

    default Optional<ZonedDateTime> getCivilEnd(LocalDate date) {
        return getSunTimes(date).civilDusk();
    }

    default Optional<ZonedDateTime> getNauticalEnd(LocalDate date) {
        return getSunTimes(date).nauticalDusk();
    }

    default Optional<ZonedDateTime> getAstronomicalEnd(LocalDate date) {
        return getSunTimes(date).astronomicalDusk();
    }

    default ZonedDateTime getMidnight(LocalDate date) {
        return getSunTimes(date).midnight();
    }

    default String toDebugString(LocalDate date) {
        return null;
    }

    default void clearCache() {
    }
}
