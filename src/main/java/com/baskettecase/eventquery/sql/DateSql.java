package com.baskettecase.eventquery.sql;

import java.util.regex.Pattern;

/**
 * SQL expression builders for time bucketing and date arithmetic.
 *
 * Every method returns SQL text only. Field and column arguments are SQL expressions
 * chosen by the calling query, never request values. Timezones and intervals may come
 * from a request, so they are checked before being quoted into the SQL.
 */
public final class DateSql {

    public static final String UTC = "utc";

    // IANA names (Region/City), abbreviations and numeric offsets
    private static final Pattern TIMEZONE = Pattern.compile("[A-Za-z+\\-][A-Za-z0-9_+\\-:]*(/[A-Za-z0-9_+\\-]+)*");
    private static final Pattern INTERVAL = Pattern.compile(
            "-?\\d+ (second|minute|hour|day|week|month|year)s?", Pattern.CASE_INSENSITIVE);

    private DateSql() {
    }

    /**
     * @throws IllegalArgumentException if {@code interval} is not {@code <n> <unit>}, e.g. {@code 1 day}
     */
    public static String addInterval(String field, String interval) {
        return String.format("%s + interval '%s'", field, requireInterval(interval));
    }

    public static String dayDiff(String field1, String field2) {
        return String.format("%s::date - %s::date", field1, field2);
    }

    public static String castColumn(String field, String type) {
        return String.format("%s::%s", field, type);
    }

    /**
     * Truncate a timestamp to a bucket and format it as a label.
     *
     * With a non-UTC timezone the field is converted first and labelled in local time;
     * otherwise it is truncated in UTC and the label ends in {@code Z}.
     *
     * @throws IllegalArgumentException if {@code timezone} is not a timezone name or offset
     */
    public static String date(String field, String unit, String timezone) {
        return date(field, DateUnit.fromName(unit), timezone);
    }

    public static String date(String field, DateUnit unit, String timezone) {
        if (isZoned(timezone)) {
            return String.format("to_char(date_trunc('%s', %s at time zone '%s'), '%s')",
                    unit.sqlName(), field, requireTimezone(timezone), unit.localFormat());
        }

        return String.format("to_char(date_trunc('%s', %s), '%s')",
                unit.sqlName(), field, unit.utcFormat());
    }

    /**
     * Day of week (0-6) and zero padded hour, as {@code "<dow>:<HH>"}, in the given timezone.
     */
    public static String dateWeekly(String field, String timezone) {
        String zone = timezone == null || timezone.isBlank() ? UTC : timezone;

        return String.format(
                "concat(extract(dow from (%1$s at time zone '%2$s')), ':', to_char((%1$s at time zone '%2$s'), 'HH24'))",
                field, requireTimezone(zone));
    }

    public static String timestamp(String field) {
        return String.format("floor(extract(epoch from %s))", field);
    }

    /**
     * Whole seconds elapsed from {@code field1} to {@code field2}.
     */
    public static String timestampDiff(String field1, String field2) {
        return String.format("floor(extract(epoch from (%s - %s)))", field2, field1);
    }

    public static String search(String column) {
        return search(column, "search");
    }

    /**
     * @throws IllegalArgumentException if {@code column} is not a plain (optionally qualified) name
     */
    public static String search(String column, String param) {
        return String.format("and %s ilike {{%s}}", SqlIdentifiers.requireIdentifier(column), param);
    }

    static String requireTimezone(String timezone) {
        if (timezone == null || !TIMEZONE.matcher(timezone).matches()) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone);
        }
        return timezone;
    }

    static String requireInterval(String interval) {
        if (interval == null || !INTERVAL.matcher(interval.trim()).matches()) {
            throw new IllegalArgumentException("Invalid interval: " + interval);
        }
        return interval.trim();
    }

    private static boolean isZoned(String timezone) {
        return timezone != null && !timezone.isBlank() && !UTC.equalsIgnoreCase(timezone);
    }
}
