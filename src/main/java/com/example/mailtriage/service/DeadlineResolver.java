package com.example.mailtriage.service;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves free-text deadline phrases ("tomorrow 3pm PT", "next Friday", "March 3") into
 * absolute timestamps relative to a reference instant.
 */
@Component
@Slf4j
public class DeadlineResolver {

    public static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final Map<String, String> ZONE_ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ZONE_ABBREVIATIONS.put("pt", "America/Los_Angeles");
        ZONE_ABBREVIATIONS.put("pst", "America/Los_Angeles");
        ZONE_ABBREVIATIONS.put("pdt", "America/Los_Angeles");
        ZONE_ABBREVIATIONS.put("mt", "America/Denver");
        ZONE_ABBREVIATIONS.put("mst", "America/Denver");
        ZONE_ABBREVIATIONS.put("mdt", "America/Denver");
        ZONE_ABBREVIATIONS.put("ct", "America/Chicago");
        ZONE_ABBREVIATIONS.put("cst", "America/Chicago");
        ZONE_ABBREVIATIONS.put("cdt", "America/Chicago");
        ZONE_ABBREVIATIONS.put("et", "America/New_York");
        ZONE_ABBREVIATIONS.put("est", "America/New_York");
        ZONE_ABBREVIATIONS.put("edt", "America/New_York");
        ZONE_ABBREVIATIONS.put("utc", "UTC");
        ZONE_ABBREVIATIONS.put("gmt", "UTC");
    }

    private static final Pattern EXPLICIT_OFFSET = Pattern.compile("\\b(?:utc|gmt)\\s?([+-]\\d{1,2}(?::?\\d{2})?)\\b");
    private static final Pattern ZONE_ABBREVIATION = Pattern.compile("\\b(pst|pdt|pt|mst|mdt|mt|cst|cdt|ct|est|edt|et|utc|gmt)\\b");

    private static final Pattern TIME_12H = Pattern.compile("\\b(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?m\\b\\.?");
    private static final Pattern TIME_24H = Pattern.compile("\\b(\\d{1,2}):(\\d{2})\\b");
    private static final Pattern END_OF_DAY = Pattern.compile("\\b(?:eod|cob|end\\s+of\\s+(?:the\\s+)?(?:business\\s+)?day)\\b");
    private static final Pattern END_OF_WEEK = Pattern.compile("\\b(?:eow|end\\s+of\\s+(?:the\\s+)?week)\\b");

    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(monday|tuesday|wednesday|thursday|friday|saturday|sunday|mon|tues?|wed|thu(?:rs?)?|fri)\\b");
    private static final Pattern NEXT = Pattern.compile("\\bnext\\b");
    private static final Pattern OFFSET_AMOUNT = Pattern.compile("\\b(?:in|within)\\s+(\\d{1,4})\\s+(minute|hour|day|week|month)s?\\b");
    private static final Pattern NEXT_WEEK = Pattern.compile("\\bnext\\s+week\\b");

    private static final String MONTH_NAMES =
            "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH_NAMES + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH_NAMES + "\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern SLASH_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2,4}))?\\b");

    private static final LocalTime END_OF_DAY_TIME = LocalTime.of(17, 0);

    /**
     * Resolves {@code text} against {@code reference}. Empty when nothing date-like is found.
     */
    public Optional<ResolvedDeadline> resolve(String text, ZonedDateTime reference, ZoneId defaultZone) {
        if (text == null || text.isBlank() || reference == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Optional<ZonedDateTime> iso = parseIso(trimmed, defaultZone);
        if (iso.isPresent()) {
            return Optional.of(new ResolvedDeadline(iso.get(), !isDateOnly(trimmed), iso.get().getZone().getId()));
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        ZoneId zone = detectZone(lower).orElse(defaultZone);
        ZonedDateTime base = reference.withZoneSameInstant(zone);
        Optional<LocalTime> time = timeOfDay(lower);

        try {
            Optional<ZonedDateTime> relativeInstant = relativeInstant(lower, base);
            if (relativeInstant.isPresent()) {
                return Optional.of(new ResolvedDeadline(relativeInstant.get(), true, zone.getId()));
            }
            Optional<LocalDate> day = relativeDay(lower, base.toLocalDate());
            if (day.isEmpty()) {
                day = calendarDay(lower, base.toLocalDate());
            }
            if (day.isEmpty() && time.isPresent()) {
                day = Optional.of(base.toLocalDate());
            }
            if (day.isEmpty()) {
                return Optional.empty();
            }
            ZonedDateTime resolved = ZonedDateTime.of(day.get(), time.orElse(LocalTime.MIDNIGHT), zone);
            return Optional.of(new ResolvedDeadline(resolved, time.isPresent(), zone.getId()));
        } catch (DateTimeException e) {
            log.debug("Could not resolve deadline '{}': {}", trimmed, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Strict ISO-8601 parse: offset date-time kept as written, local date-time placed in
     * {@code defaultZone}, date-only at start of day.
     */
    public Optional<ZonedDateTime> parseIso(String value, ZoneId defaultZone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            return Optional.of(OffsetDateTime.parse(trimmed).toZonedDateTime());
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not an offset date-time", trimmed);
        }
        try {
            return Optional.of(LocalDateTime.parse(trimmed).atZone(defaultZone));
        } catch (DateTimeParseException e) {
            log.trace("'{}' is not a local date-time", trimmed);
        }
        try {
            return Optional.of(LocalDate.parse(trimmed).atStartOfDay(defaultZone));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * True when the phrase names a clock time (including noon, midnight and end of day).
     */
    public static boolean mentionsTime(String text) {
        return text != null && timeOfDay(text.toLowerCase(Locale.ROOT)).isPresent();
    }

    private static boolean isDateOnly(String trimmed) {
        return trimmed.length() == 10 && trimmed.charAt(4) == '-' && trimmed.charAt(7) == '-';
    }

    private static Optional<ZoneId> detectZone(String lower) {
        Matcher offset = EXPLICIT_OFFSET.matcher(lower);
        if (offset.find()) {
            try {
                return Optional.of(ZoneOffset.of(normalizeOffset(offset.group(1))));
            } catch (DateTimeException e) {
                log.debug("Ignoring invalid offset '{}'", offset.group(1));
            }
        }
        Matcher abbreviation = ZONE_ABBREVIATION.matcher(lower);
        if (abbreviation.find()) {
            return Optional.of(ZoneId.of(ZONE_ABBREVIATIONS.get(abbreviation.group(1))));
        }
        return Optional.empty();
    }

    private static String normalizeOffset(String raw) {
        String sign = raw.substring(0, 1);
        String digits = raw.substring(1).replace(":", "");
        if (digits.length() <= 2) {
            return sign + (digits.length() == 1 ? "0" + digits : digits) + ":00";
        }
        String hours = digits.substring(0, digits.length() - 2);
        return sign + (hours.length() == 1 ? "0" + hours : hours) + ":" + digits.substring(digits.length() - 2);
    }

    private static Optional<LocalTime> timeOfDay(String lower) {
        if (lower.contains("noon")) {
            return Optional.of(LocalTime.NOON);
        }
        if (lower.contains("midnight")) {
            return Optional.of(LocalTime.MIDNIGHT);
        }
        Matcher twelveHour = TIME_12H.matcher(lower);
        while (twelveHour.find()) {
            int hour = Integer.parseInt(twelveHour.group(1));
            int minute = twelveHour.group(2) != null ? Integer.parseInt(twelveHour.group(2)) : 0;
            if (hour >= 1 && hour <= 12 && minute <= 59) {
                boolean pm = "p".equals(twelveHour.group(3));
                int hourOfDay = pm ? (hour == 12 ? 12 : hour + 12) : (hour == 12 ? 0 : hour);
                return Optional.of(LocalTime.of(hourOfDay, minute));
            }
        }
        Matcher twentyFourHour = TIME_24H.matcher(lower);
        while (twentyFourHour.find()) {
            int hour = Integer.parseInt(twentyFourHour.group(1));
            int minute = Integer.parseInt(twentyFourHour.group(2));
            if (hour <= 23 && minute <= 59) {
                return Optional.of(LocalTime.of(hour, minute));
            }
        }
        if (END_OF_DAY.matcher(lower).find()) {
            return Optional.of(END_OF_DAY_TIME);
        }
        return Optional.empty();
    }

    /** "in 3 hours" style offsets keep the reference clock time. */
    private static Optional<ZonedDateTime> relativeInstant(String lower, ZonedDateTime base) {
        Matcher matcher = OFFSET_AMOUNT.matcher(lower);
        if (!matcher.find()) {
            return Optional.empty();
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2);
        if ("minute".equals(unit)) {
            return Optional.of(base.plusMinutes(amount).truncatedTo(ChronoUnit.MINUTES));
        }
        if ("hour".equals(unit)) {
            return Optional.of(base.plusHours(amount).truncatedTo(ChronoUnit.MINUTES));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> relativeDay(String lower, LocalDate today) {
        if (lower.contains("day after tomorrow")) {
            return Optional.of(today.plusDays(2));
        }
        if (lower.contains("tomorrow")) {
            return Optional.of(today.plusDays(1));
        }
        if (lower.contains("today") || lower.contains("tonight")) {
            return Optional.of(today);
        }
        Matcher offset = OFFSET_AMOUNT.matcher(lower);
        if (offset.find()) {
            long amount = Long.parseLong(offset.group(1));
            switch (offset.group(2)) {
                case "day":
                    return Optional.of(today.plusDays(amount));
                case "week":
                    return Optional.of(today.plusWeeks(amount));
                case "month":
                    return Optional.of(today.plusMonths(amount));
                default:
                    break;
            }
        }
        if (NEXT_WEEK.matcher(lower).find()) {
            return Optional.of(today.with(TemporalAdjusters.next(DayOfWeek.MONDAY)));
        }
        if (END_OF_WEEK.matcher(lower).find()) {
            return Optional.of(today.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY)));
        }
        Matcher weekday = WEEKDAY.matcher(lower);
        if (weekday.find()) {
            DayOfWeek target = dayOfWeek(weekday.group(1));
            int delta = Math.floorMod(target.getValue() - today.getDayOfWeek().getValue(), 7);
            if (delta == 0) {
                delta = 7;
            }
            if (NEXT.matcher(lower).find()) {
                delta += 7;
            }
            return Optional.of(today.plusDays(delta));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> calendarDay(String lower, LocalDate today) {
        Matcher iso = ISO_DATE.matcher(lower);
        if (iso.find()) {
            return safeDate(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)));
        }
        Matcher monthDay = MONTH_DAY.matcher(lower);
        if (monthDay.find()) {
            int year = monthDay.group(3) != null ? Integer.parseInt(monthDay.group(3)) : today.getYear();
            return safeDate(year, month(monthDay.group(1)), Integer.parseInt(monthDay.group(2)));
        }
        Matcher dayMonth = DAY_MONTH.matcher(lower);
        if (dayMonth.find()) {
            int year = dayMonth.group(3) != null ? Integer.parseInt(dayMonth.group(3)) : today.getYear();
            return safeDate(year, month(dayMonth.group(2)), Integer.parseInt(dayMonth.group(1)));
        }
        Matcher slash = SLASH_DATE.matcher(lower);
        if (slash.find()) {
            int year = today.getYear();
            if (slash.group(3) != null) {
                year = Integer.parseInt(slash.group(3));
                if (year < 100) {
                    year += 2000;
                }
            }
            return safeDate(year, Integer.parseInt(slash.group(1)), Integer.parseInt(slash.group(2)));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> safeDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static int month(String name) {
        switch (name.substring(0, 3)) {
            case "jan": return 1;
            case "feb": return 2;
            case "mar": return 3;
            case "apr": return 4;
            case "may": return 5;
            case "jun": return 6;
            case "jul": return 7;
            case "aug": return 8;
            case "sep": return 9;
            case "oct": return 10;
            case "nov": return 11;
            default: return 12;
        }
    }

    private static DayOfWeek dayOfWeek(String name) {
        switch (name.substring(0, 3)) {
            case "mon": return DayOfWeek.MONDAY;
            case "tue": return DayOfWeek.TUESDAY;
            case "wed": return DayOfWeek.WEDNESDAY;
            case "thu": return DayOfWeek.THURSDAY;
            case "fri": return DayOfWeek.FRIDAY;
            case "sat": return DayOfWeek.SATURDAY;
            default: return DayOfWeek.SUNDAY;
        }
    }

    @Value
    public static class ResolvedDeadline {
        ZonedDateTime dateTime;
        boolean timeOfDay;
        String zoneName;

        /** Full timestamp when a clock time was given, otherwise the calendar date. */
        public String iso() {
            return timeOfDay ? dateTime.format(DATE_TIME_FORMAT) : dateTime.format(DATE_FORMAT);
        }

        public String timestamp() {
            return dateTime.format(DATE_TIME_FORMAT);
        }
    }
}
