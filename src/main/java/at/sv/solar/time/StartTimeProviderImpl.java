package at.sv.solar.time;

import at.sv.solar.SunEvent;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

public final class StartTimeProviderImpl implements StartTimeProvider {

    private final SunTimesProvider sunTimesProvider;

    public StartTimeProviderImpl(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
    }

    @Override
    public Optional<ZonedDateTime> getStart(String input, LocalDate date) {
        if (input == null || input.isBlank()) {
            throw new InvalidStartTimeExpression("Empty start time expression");
        }
        Optional<LocalTime> time = tryParseTimeString(input.trim());
        if (time.isPresent()) {
            return Optional.of(ZonedDateTime.of(date, time.get(), ZoneOffset.UTC));
        }
        try {
            if (isOffsetExpression(input)) {
                return parseOffsetExpression(input, date);
            }
            return parseSunKeywords(input, date);
        } catch (Exception e) {
            throw new InvalidStartTimeExpression("Failed to parse start time expression '" + input + "': " + e.getMessage());
        }
    }

    private Optional<LocalTime> tryParseTimeString(String input) {
        if (!Character.isDigit(input.charAt(0))) {
            return Optional.empty();
        }

        try {
            return Optional.of(LocalTime.parse(input));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private boolean isOffsetExpression(String input) {
        return input.contains("+") || input.contains("-");
    }

    private Optional<ZonedDateTime> parseOffsetExpression(String input, LocalDate date) {
        String[] parts = input.split("[+-]");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected a single offset in minutes");
        }
        Optional<ZonedDateTime> startTime = parseSunKeywords(parts[0].trim(), date);
        int offset = Integer.parseInt(parts[1].trim());
        if (input.contains("+")) {
            return startTime.map(time -> time.plusMinutes(offset));
        } else {
            return startTime.map(time -> time.minusMinutes(offset));
        }
    }

    private Optional<ZonedDateTime> parseSunKeywords(String input, LocalDate date) {
        SunEvent event = SunEvent.fromKeyword(input)
                                 .orElseThrow(() -> new IllegalArgumentException("Invalid sun keyword: '" + input + "'"));
        return switch (event) {
            case ASTRONOMICAL_DAWN -> sunTimesProvider.getAstronomicalStart(date);
            case NAUTICAL_DAWN -> sunTimesProvider.getNauticalStart(date);
            case CIVIL_DAWN -> sunTimesProvider.getCivilStart(date);
            case SUNRISE -> sunTimesProvider.getSunrise(date);
            case NOON -> Optional.of(sunTimesProvider.getNoon(date));
            case SUNSET -> sunTimesProvider.getSunset(date);
            case CIVIL_DUSK -> sunTimesProvider.getCivilEnd(date);
            case NAUTICAL_DUSK -> sunTimesProvider.getNauticalEnd(date);
            case ASTRONOMICAL_DUSK -> sunTimesProvider.getAstronomicalEnd(date);
            case MIDNIGHT -> Optional.of(sunTimesProvider.getMidnight(date));
        };
    }
}
