package com.incidents.stats.model;

import com.incidents.stats.model.readonly.IncidentDocument;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stats filter as given on the query string. Unrecognized values fall back to no constraint.
 *
 * @param day    today, yesterday or all (region local calendar day)
 * @param status open, closed or all
 * @param city   case-insensitive substring of city or place text, null for any
 * @param type   exact event type tag, null for any
 * @param month  YYYY-MM, null for any
 */
public record StatsFilter(String day, String status, String city, String type, String month) {

    public static final String ALL = "all";

    private static final Set<String> DAYS = Set.of("today", "yesterday", ALL);
    private static final Set<String> STATUSES = Set.of("open", "closed", ALL);
    private static final Pattern MONTH = Pattern.compile("^\\d{4}-\\d{2}$");

    public static StatsFilter of(String day, String status, String city, String type, String month) {
        return new StatsFilter(oneOf(day, DAYS), oneOf(status, STATUSES), blankToNull(city), blankToNull(type),
                validMonth(month));
    }

    public static StatsFilter none() {
        return new StatsFilter(ALL, ALL, null, null, null);
    }

    /**
     * Event-time range selected by day and month, or null when neither applies
     */
    public EventWindow window(ZoneId zone, LocalDate today) {
        Instant from = null;
        Instant to = null;
        if ("today".equals(day) || "yesterday".equals(day)) {
            LocalDate date = "yesterday".equals(day) ? today.minusDays(1) : today;
            from = date.atStartOfDay(zone).toInstant();
            to = date.plusDays(1).atStartOfDay(zone).toInstant();
        }
        if (month != null) {
            YearMonth ym = YearMonth.parse(month);
            Instant monthFrom = ym.atDay(1).atStartOfDay(zone).toInstant();
            Instant monthTo = ym.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
            from = from == null || monthFrom.isAfter(from) ? monthFrom : from;
            to = to == null || monthTo.isBefore(to) ? monthTo : to;
        }
        if (from == null) {
            return null;
        }
        return new EventWindow(from, to.isAfter(from) ? to : from);
    }

    /**
     * Every constraint of this filter
     */
    public boolean matches(IncidentDocument incident, ZoneId zone, LocalDate today) {
        return matchesStatus(incident) && matchesPlaceAndType(incident) && matchesDay(incident, zone, today)
                && matchesMonth(incident, zone);
    }

    /**
     * City, type and month only; status and day are ignored
     */
    public boolean matchesIgnoringStatusAndDay(IncidentDocument incident, ZoneId zone) {
        return matchesPlaceAndType(incident) && matchesMonth(incident, zone);
    }

    private boolean matchesStatus(IncidentDocument incident) {
        return switch (status) {
            case "open" -> !incident.isClosed();
            case "closed" -> incident.isClosed();
            default -> true;
        };
    }

    private boolean matchesPlaceAndType(IncidentDocument incident) {
        if (type != null && !type.equals(incident.getEventType())) {
            return false;
        }
        if (city != null) {
            String needle = city.toLowerCase(Locale.ROOT);
            return contains(incident.getCityText(), needle) || contains(incident.getPlaceText(), needle);
        }
        return true;
    }

    private boolean matchesDay(IncidentDocument incident, ZoneId zone, LocalDate today) {
        if (ALL.equals(day)) {
            return true;
        }
        LocalDate wanted = "yesterday".equals(day) ? today.minusDays(1) : today;
        LocalDate local = localDate(incident, zone);
        return wanted.equals(local);
    }

    private boolean matchesMonth(IncidentDocument incident, ZoneId zone) {
        if (month == null) {
            return true;
        }
        LocalDate local = localDate(incident, zone);
        return local != null && YearMonth.from(local).toString().equals(month);
    }

    private static LocalDate localDate(IncidentDocument incident, ZoneId zone) {
        Instant eventTime = incident.resolveEventTime();
        return eventTime == null ? null : eventTime.atZone(zone).toLocalDate();
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
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
