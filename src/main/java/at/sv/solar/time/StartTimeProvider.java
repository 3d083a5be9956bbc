package at.sv.solar.time;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;

public interface StartTimeProvider {
    /**
     * @param input a ISO_LOCAL_TIME formatted string, or a sun keyword with optional offset in minutes
     * @param date  the UTC date to use as reference for resolving sun times
     * @return the UTC start time corresponding to the input and date, or empty if the referenced sun event does not
     * occur on that date
     * @throws InvalidStartTimeExpression if the input is neither a valid {@link java.time.format.DateTimeFormatter#ISO_LOCAL_TIME}
     *                                    or a supported sun keyword with optional offset.
     */
    Optional<ZonedDateTime> getStart(String input, LocalDate date);
}
