package org.bookshelf.util;

import lombok.experimental.UtilityClass;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

@UtilityClass
public class ImportDateUtils {

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT),
            DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ROOT),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT)
    );

    /**
     * Parses a date in the given source format and re-emits it as ISO {@code yyyy-MM-dd}.
     * Anything that does not parse, including blank input, yields {@code null}.
     */
    public static String toIsoDate(String value, DateTimeFormatter sourceFormat) {
        LocalDate date = parse(value, sourceFormat);
        return date == null ? null : date.toString();
    }

    public static LocalDate parse(String value, DateTimeFormatter sourceFormat) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (sourceFormat != null) {
            LocalDate date = tryParse(trimmed, sourceFormat);
            if (date != null) {
                return date;
            }
        }
        for (DateTimeFormatter format : FALLBACK_FORMATS) {
            LocalDate date = tryParse(trimmed, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate tryParse(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
