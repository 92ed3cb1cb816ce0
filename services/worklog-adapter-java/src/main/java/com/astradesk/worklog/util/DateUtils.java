package com.astradesk.worklog.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calendar-date helpers working on {@code YYYY-MM-DD} strings.
 *
 * <p>All arithmetic goes through {@link LocalDate}, which carries no time of day and no
 * zone, so daylight-saving transitions or the server's default zone can never shift a
 * result by one day.</p>
 */
public final class DateUtils {

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DAY_FIRST_DATE = Pattern.compile("(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})");

    private DateUtils() {
    }

    public static String addDays(String date, int days) {
        return parse(date).plusDays(days).toString();
    }

    public static String subtractDays(String date, int days) {
        return parse(date).minusDays(days).toString();
    }

    public static String nextDay(String date) {
        return addDays(date, 1);
    }

    /**
     * Every calendar day from {@code from} to {@code to}, both inclusive. Empty when
     * {@code from} is after {@code to}.
     */
    public static List<String> daysBetweenInclusive(String from, String to) {
        LocalDate end = parse(to);
        List<String> days = new ArrayList<>();
        for (LocalDate day = parse(from); !day.isAfter(end); day = day.plusDays(1)) {
            days.add(day.toString());
        }
        return days;
    }

    /**
     * Rewrites {@code DD-MM-YYYY} and {@code DD/MM/YYYY} to {@code YYYY-MM-DD}. ISO input is
     * returned as is; any other shape is returned trimmed but otherwise untouched.
     */
    public static String normalizeToIsoDate(String input) {
        if (input == null) {
            return null;
        }
        String trimmed = input.trim();
        if (ISO_DATE.matcher(trimmed).matches()) {
            return trimmed;
        }
        Matcher dayFirst = DAY_FIRST_DATE.matcher(trimmed);
        if (dayFirst.matches()) {
            return "%s-%s-%s".formatted(dayFirst.group(3), pad(dayFirst.group(2)), pad(dayFirst.group(1)));
        }
        return trimmed;
    }

    /**
     * True for a {@code YYYY-MM-DD} string naming a real calendar day.
     */
    public static boolean isIsoDate(String input) {
        if (input == null || !ISO_DATE.matcher(input).matches()) {
            return false;
        }
        try {
            LocalDate.parse(input);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * The {@code YYYY-MM-DD} part of a Jira timestamp such as {@code 2024-01-05T09:00:00.000+0100}.
     * The date is taken as written, in the author's own offset.
     */
    public static String datePart(String timestamp) {
        int separator = timestamp.indexOf('T');
        return separator < 0 ? timestamp : timestamp.substring(0, separator);
    }

    private static LocalDate parse(String date) {
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a YYYY-MM-DD date: " + date, e);
        }
    }

    private static String pad(String part) {
        return part.length() == 1 ? "0" + part : part;
    }
}
