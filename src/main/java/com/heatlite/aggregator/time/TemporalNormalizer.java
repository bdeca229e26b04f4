package com.heatlite.aggregator.time;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw date or year cells into calendar dates.
 *
 * Bare years become July 1 of that year so that a year's events sit in the middle
 * of it rather than on a window boundary. Anything that cannot be parsed yields
 * {@link Optional#empty()}; a bad cell never aborts the run.
 */
public final class TemporalNormalizer {

    public static final int ANCHOR_MONTH = 7;
    public static final int ANCHOR_DAY = 1;

    private static final Pattern BARE_YEAR = Pattern.compile("\\d{4}");

    // Tried in order, first success wins
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        strict("uuuu-MM-dd HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm"),
        strict("uuuu/MM/dd"),
        strict("M/d/uuuu"),
        new DateTimeFormatterBuilder()
            .appendPattern("M/d/")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1950)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT),
        strict("M/d/uuuu H:mm"),
        caseInsensitive("d-MMM-uuuu"),
        caseInsensitive("MMM d, uuuu"),
        caseInsensitive("MMMM d, uuuu"),
        DateTimeFormatter.BASIC_ISO_DATE,
        new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM")
            .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT)
    );

    private TemporalNormalizer() {}

    /**
     * Normalizes a whole column. The result has one entry per input value, in order.
     */
    public static List<Optional<LocalDate>> normalize(List<String> rawValues, boolean yearOnly) {
        var out = new ArrayList<Optional<LocalDate>>(rawValues.size());
        for (String raw : rawValues) {
            out.add(normalize(raw, yearOnly));
        }
        return out;
    }

    public static Optional<LocalDate> normalize(String raw, boolean yearOnly) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        return yearOnly ? parseYear(text) : parseDate(text);
    }

    /**
     * Accepts integral numbers, including the {@code 1995.0} form that spreadsheet
     * exports produce for year columns with holes.
     */
    static Optional<LocalDate> parseYear(String text) {
        try {
            BigDecimal value = new BigDecimal(text);
            int year = value.intValueExact();
            if (year < 1 || year > 9999) {
                return Optional.empty();
            }
            return Optional.of(midYear(year));
        } catch (NumberFormatException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDate> parseDate(String text) {
        if (BARE_YEAR.matcher(text).matches()) {
            return Optional.of(midYear(Integer.parseInt(text)));
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    public static LocalDate midYear(int year) {
        return LocalDate.of(year, ANCHOR_MONTH, ANCHOR_DAY);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
