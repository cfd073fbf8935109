package org.bookshelf.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes ISBN values as they appear in spreadsheet exports before they are used for lookups.
 */
@UtilityClass
public class IsbnUtils {

    private static final Pattern NON_ISBN_CHARACTERS = Pattern.compile("[^0-9Xx]");
    private static final Pattern ISBN13_PATTERN = Pattern.compile("97[89]\\d{10}");
    private static final Pattern ISBN10_PATTERN = Pattern.compile("\\d{9}[\\dX]");

    /**
     * Strips everything except digits and the X check digit, including the {@code ="..."} wrapper
     * spreadsheet exports put around ISBN columns.
     *
     * @return cleaned ISBN, or {@code null} if nothing usable remains
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NON_ISBN_CHARACTERS.matcher(raw).replaceAll("");
        if (cleaned.isBlank()) {
            return null;
        }
        return cleaned.toUpperCase(Locale.ROOT);
    }

    /**
     * True for a 978/979 prefixed thirteen digit value whose check digit is correct.
     */
    public static boolean isValidIsbn13(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null
                && ISBN13_PATTERN.matcher(cleaned).matches()
                && checkDigit13(cleaned.substring(0, 12)) == cleaned.charAt(12) - '0';
    }

    public static boolean isValidIsbn10(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null && ISBN10_PATTERN.matcher(cleaned).matches();
    }

    /**
     * Returns the ISBN-13 form of an ISBN-10 or a valid ISBN-13, or {@code null} when the input is neither.
     * Thirteen digit values with a wrong prefix or check digit, such as catalog UIDs, are not ISBNs.
     */
    public static String toIsbn13(String raw) {
        String cleaned = sanitize(raw);
        if (cleaned == null) {
            return null;
        }
        if (cleaned.length() == 13) {
            return isValidIsbn13(cleaned) ? cleaned : null;
        }
        if (!ISBN10_PATTERN.matcher(cleaned).matches()) {
            return null;
        }
        String body = "978" + cleaned.substring(0, 9);
        return body + checkDigit13(body);
    }

    private static int checkDigit13(String firstTwelveDigits) {
        int sum = 0;
        for (int i = 0; i < firstTwelveDigits.length(); i++) {
            int digit = firstTwelveDigits.charAt(i) - '0';
            sum += (i % 2 == 0) ? digit : digit * 3;
        }
        return (10 - (sum % 10)) % 10;
    }
}
