package com.conveyal.busevents.util;

/**
 * Small formatting helpers for log output.
 */
public abstract class Util {

    /** Abbreviate a large count for log messages, e.g. 1500 becomes "1k" and 2500000 becomes "2.5M". */
    public static String human (int n) {
        if (n >= 1000000000) return String.format("%.1fG", n / 1000000000.0);
        if (n >= 1000000) return String.format("%.1fM", n / 1000000.0);
        if (n >= 1000) return String.format("%dk", n / 1000);
        return String.format("%d", n);
    }
}
