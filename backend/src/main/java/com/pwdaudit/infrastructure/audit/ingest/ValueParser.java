package com.pwdaudit.infrastructure.audit.ingest;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cell value coercion shared by the alias table and the record factory.
 * Blank cells and ledger placeholders ("-", "N/A", "nil") come back as null;
 * anything else that does not parse raises {@link IllegalArgumentException}.
 */
public final class ValueParser {

    private static final Set<String> BLANK_MARKERS = Set.of("", "-", "--", "n/a", "na", "nil", "none", "null");

    private static final Pattern ISO_DATE = Pattern.compile("(\\d{4})-(\\d{1,2})-(\\d{1,2})");

    // Indian ledgers write day first: 31-03-2024, 31/3/2024, 31.03.2024
    private static final Pattern DAY_FIRST_DATE = Pattern.compile("(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4})");

    // Spreadsheet serial day 0
    private static final LocalDate SHEET_EPOCH = LocalDate.of(1899, 12, 30);

    // 9999-12-31, the last day a spreadsheet can hold
    private static final long MAX_SHEET_SERIAL = 2_958_465L;

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1", "deposit", "होय", "हाँ");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0", "नाही", "नहीं");

    private ValueParser() {
    }

    public static String text(Object value) {
        if (value == null) return null;
        String text = value.toString().strip();
        return isBlankMarker(text) ? null : text;
    }

    public static BigDecimal decimal(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof Integer || value instanceof Long) return BigDecimal.valueOf(((Number) value).longValue());
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) throw new IllegalArgumentException("not a finite number: " + value);
            return BigDecimal.valueOf(d);
        }
        String text = text(value);
        if (text == null) return null;
        String cleaned = text.replace(",", "").replace("₹", "").replace("%", "").strip();
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: \"" + text + "\"", e);
        }
    }

    public static Integer integer(Object value) {
        BigDecimal number = decimal(value);
        if (number == null) return null;
        try {
            return number.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("not a whole number: \"" + value + "\"", e);
        }
    }

    public static LocalDate date(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDate date) return date;
        if (value instanceof LocalDateTime dateTime) return dateTime.toLocalDate();
        if (value instanceof Number number) {
            return serialDate(number);
        }
        String text = text(value);
        if (text == null) return null;
        // "2024-03-31 00:00:00" as exported by spreadsheet tools
        String datePart = text.length() > 10 && text.charAt(10) == ' ' ? text.substring(0, 10) : text;
        Matcher iso = ISO_DATE.matcher(datePart);
        if (iso.matches()) {
            return toDate(text, iso.group(1), iso.group(2), iso.group(3));
        }
        Matcher dayFirst = DAY_FIRST_DATE.matcher(datePart);
        if (dayFirst.matches()) {
            return toDate(text, dayFirst.group(3), dayFirst.group(2), dayFirst.group(1));
        }
        throw new IllegalArgumentException("unrecognised date: \"" + text + "\"");
    }

    public static Boolean bool(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        String text = text(value);
        if (text == null) return null;
        String lower = text.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) return Boolean.TRUE;
        if (FALSE_WORDS.contains(lower)) return Boolean.FALSE;
        throw new IllegalArgumentException("not a yes/no value: \"" + text + "\"");
    }

    private static LocalDate serialDate(Number number) {
        double serial = number.doubleValue();
        if (!Double.isFinite(serial) || serial < 1 || serial >= MAX_SHEET_SERIAL + 1) {
            throw new IllegalArgumentException("date serial out of range: " + number);
        }
        try {
            return SHEET_EPOCH.plusDays((long) serial);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("impossible date serial: " + number, e);
        }
    }

    private static LocalDate toDate(String original, String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("impossible date: \"" + original + "\"", e);
        }
    }

    private static boolean isBlankMarker(String text) {
        return BLANK_MARKERS.contains(text.toLowerCase(Locale.ROOT));
    }
}
