package at.sv.solar;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

public final class FormatUtil {

    public static final String DOES_NOT_OCCUR = "does not occur";

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private FormatUtil() {
    }

    /**
     * Formats the time of day, prefixed with the date if it differs from the given reference date.
     */
    public static String formatTime(ZonedDateTime time, LocalDate referenceDate) {
        if (time.toLocalDate().equals(referenceDate)) {
            return TIME_FORMATTER.format(time);
        }
        return time.toLocalDate() + " " + TIME_FORMATTER.format(time);
    }

    public static String formatTime(Optional<ZonedDateTime> time, LocalDate referenceDate) {
        return time.map(t -> formatTime(t, referenceDate)).orElse(DOES_NOT_OCCUR);
    }

    /**
     * Formats the time of day only, or {@link #DOES_NOT_OCCUR} if absent.
     */
    public static String formatTimeOfDay(Optional<ZonedDateTime> time) {
        return time.map(TIME_FORMATTER::format).orElse(DOES_NOT_OCCUR);
    }

    public static String formatIso(Optional<ZonedDateTime> time) {
        return time.map(DateTimeFormatter.ISO_OFFSET_DATE_TIME::format).orElse(null);
    }
}
