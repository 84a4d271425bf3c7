package com.conveyal.busevents.util;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Conversion between wall-clock schedule strings and seconds after midnight.
 */
public abstract class TimeUtils {

    public static final int SECONDS_PER_DAY = 24 * 60 * 60;

    /** The strict form in which trip times are expected to appear in the source dataset. */
    public static final Pattern TIME_FORMAT = Pattern.compile("^\\d{1,2}:\\d{2}$");

    /**
     * Parse an "H:MM" or "HH:MM" wall clock time. Surrounding whitespace is ignored, and only the first two
     * colon-separated fields are read (there is no seconds field, so seconds are always zero).
     * @return seconds after midnight, or empty if the text is not a valid time of day.
     */
    public static OptionalInt parseTime (String text) {
        if (text == null) return OptionalInt.empty();
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return OptionalInt.empty();
        String[] fields = trimmed.split(":", -1);
        if (fields.length < 2) return OptionalInt.empty();
        int hours;
        int minutes;
        try {
            hours = Integer.parseInt(fields[0].trim());
            minutes = Integer.parseInt(fields[1].trim());
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
        if (hours < 0 || hours > 23 || minutes < 0 || minutes > 59) return OptionalInt.empty();
        return OptionalInt.of(hours * 3600 + minutes * 60);
    }

    /**
     * @return true if the text matches the strict H:MM / HH:MM form. This does not check the hour and minute ranges.
     */
    public static boolean isWellFormed (String text) {
        return text != null && TIME_FORMAT.matcher(text).matches();
    }

    /**
     * Render seconds after midnight as HH:MM:SS. Times on following days wrap around and are suffixed with the day
     * offset, e.g. 90000 seconds is "01:00:00+1d". Negative values are clamped to midnight.
     */
    public static String formatTime (int seconds) {
        if (seconds < 0) return "00:00:00";
        int days = seconds / SECONDS_PER_DAY;
        int remaining = seconds % SECONDS_PER_DAY;
        String time = String.format("%02d:%02d:%02d", remaining / 3600, (remaining % 3600) / 60, remaining % 60);
        return days > 0 ? time + "+" + days + "d" : time;
    }

    /** Render a duration as hours, minutes and seconds for log messages, e.g. "1h 5m 0s". */
    public static String formatDuration (int seconds) {
        return String.format("%dh %dm %ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
