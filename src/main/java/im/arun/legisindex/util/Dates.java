package im.arun.legisindex.util;

import java.util.regex.Pattern;

/**
 * Date normalization for LIMS attributes and {@code Date} elements.
 */
public final class Dates {
    private static final Pattern YYYYMMDD = Pattern.compile("^\\d{8}$");
    private static final Pattern YYYY_MM_DD = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private Dates() {}

    /**
     * Accepts {@code YYYYMMDD} or {@code YYYY-MM-DD}; anything else yields null.
     */
    public static String parseDate(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (YYYYMMDD.matcher(value).matches()) {
            return value.substring(0, 4) + "-" + value.substring(4, 6) + "-" + value.substring(6, 8);
        }
        if (YYYY_MM_DD.matcher(value).matches()) {
            return value;
        }
        return null;
    }

    /**
     * Builds an ISO date from the parts of a {@code Date} element. Month and day default
     * to {@code 01}; without a year there is no date.
     */
    public static String fromParts(String yyyy, String mm, String dd) {
        if (yyyy == null || yyyy.isEmpty()) {
            return null;
        }
        return yyyy + "-" + pad(mm) + "-" + pad(dd);
    }

    private static String pad(String part) {
        if (part == null || part.isEmpty()) {
            return "01";
        }
        return part.length() == 1 ? "0" + part : part;
    }
}
