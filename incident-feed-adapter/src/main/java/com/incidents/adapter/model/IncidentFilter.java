package com.incidents.adapter.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Listing filter as given on the query string. Unrecognized values fall back to "all".
 */
public record IncidentFilter(String day, String status, String city, String type, String month) {

    public static final String ALL = "all";

    private static final Set<String> DAYS = Set.of("today", "yesterday", ALL);
    private static final Set<String> STATUSES = Set.of("open", "closed", ALL);
    private static final Pattern MONTH = Pattern.compile("^\\d{4}-\\d{2}$");

    public static IncidentFilter of(String day, String status, String city, String type, String month) {
        return new IncidentFilter(
                oneOf(day, DAYS),
                oneOf(status, STATUSES),
                blankToNull(city),
                blankToNull(type),
                validMonth(month)
        );
    }

    public static IncidentFilter none() {
        return new IncidentFilter(ALL, ALL, null, null, null);
    }

    /**
     * Open/closed constraint, or null for any
     */
    public Boolean closedConstraint() {
        return switch (status) {
            case "open" -> Boolean.FALSE;
            case "closed" -> Boolean.TRUE;
            default -> null;
        };
    }

    /**
     * Event-time window selected by the day and month parameters, or null when neither constrains.
     *
     * @param today current calendar day in the region zone
     */
    public TimeWindow window(ZoneId zone, LocalDate today) {
        TimeWindow window = null;
        if ("today".equals(day) || "yesterday".equals(day)) {
            LocalDate date = "yesterday".equals(day) ? today.minusDays(1) : today;
            window = new TimeWindow(date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant());
        }
        if (month != null) {
            YearMonth ym = YearMonth.parse(month);
            TimeWindow monthWindow = new TimeWindow(
                    ym.atDay(1).atStartOfDay(zone).toInstant(),
                    ym.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant());
            window = window == null ? monthWindow : window.intersect(monthWindow);
        }
        return window;
    }

    private static String oneOf(String value, Set<String> allowed) {
        if (value == null) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return allowed.contains(normalized) ? normalized : ALL;
    }

    private static String validMonth(String month) {
        if (month == null || !MONTH.matcher(month.trim()).matches()) {
            return null;
        }
        try {
            return YearMonth.parse(month.trim()).toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
