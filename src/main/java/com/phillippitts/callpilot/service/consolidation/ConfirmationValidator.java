package com.phillippitts.callpilot.service.consolidation;

import com.phillippitts.callpilot.domain.ConfirmationEvent;
import com.phillippitts.callpilot.exception.MalformedBookingException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Checks that a confirmation carries a provider name, a {@code yyyy-MM-dd} date and an
 * {@code HH:mm} time (seconds optional), and parses them.
 *
 * <p>Parsing is strict: {@code 2025-02-30} and {@code 24:00} are rejected.
 */
@Component
public class ConfirmationValidator {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * @return the parsed fields
     * @throws MalformedBookingException naming the first field that is missing or malformed
     */
    public ValidConfirmation validate(ConfirmationEvent event) {
        if (event == null) {
            throw new MalformedBookingException("confirmation is required");
        }
        String providerName = trimToNull(event.providerName());
        if (providerName == null) {
            throw new MalformedBookingException("provider_name is required");
        }
        String rawDate = trimToNull(event.date());
        if (rawDate == null) {
            throw new MalformedBookingException("date is required");
        }
        String rawTime = trimToNull(event.time());
        if (rawTime == null) {
            throw new MalformedBookingException("time is required");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(rawDate, DATE);
        } catch (DateTimeParseException e) {
            throw new MalformedBookingException("date must be yyyy-MM-dd, got '" + rawDate + "'");
        }
        LocalTime time;
        try {
            time = LocalTime.parse(rawTime, TIME);
        } catch (DateTimeParseException e) {
            throw new MalformedBookingException("time must be HH:mm, got '" + rawTime + "'");
        }
        return new ValidConfirmation(
                trimToNull(event.sessionRef()),
                providerName,
                date,
                time,
                trimToNull(event.title()),
                trimToNull(event.requesterPhone()));
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * A confirmation whose required fields are present and parsed.
     */
    public record ValidConfirmation(String sessionRef, String providerName, LocalDate date, LocalTime time,
                                    String title, String requesterPhone) { }
}
