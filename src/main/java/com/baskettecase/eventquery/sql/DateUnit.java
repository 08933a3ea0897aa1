package com.baskettecase.eventquery.sql;

import java.util.Locale;

/**
 * Granularities accepted by {@code date_trunc}, each with its bucket label format.
 *
 * The UTC format carries a literal {@code Z}; the local one does not. Consumers read the
 * suffix to tell whether a label is already zone qualified, so the two must stay apart.
 */
public enum DateUnit {
    MINUTE("YYYY-MM-DD HH24:MI:00", "YYYY-MM-DD\"T\"HH24:MI:00\"Z\""),
    HOUR("YYYY-MM-DD HH24:00:00", "YYYY-MM-DD\"T\"HH24:00:00\"Z\""),
    DAY("YYYY-MM-DD HH24:00:00", "YYYY-MM-DD\"T\"HH24:00:00\"Z\""),
    MONTH("YYYY-MM-01 HH24:00:00", "YYYY-MM-01\"T\"HH24:00:00\"Z\""),
    YEAR("YYYY-01-01 HH24:00:00", "YYYY-01-01\"T\"HH24:00:00\"Z\"");

    private final String localFormat;
    private final String utcFormat;

    DateUnit(String localFormat, String utcFormat) {
        this.localFormat = localFormat;
        this.utcFormat = utcFormat;
    }

    public String sqlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String localFormat() {
        return localFormat;
    }

    public String utcFormat() {
        return utcFormat;
    }

    public static DateUnit fromName(String unit) {
        if (unit == null) {
            throw new IllegalArgumentException("Date unit is required");
        }
        for (DateUnit value : values()) {
            if (value.sqlName().equalsIgnoreCase(unit.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported date unit: " + unit);
    }
}
