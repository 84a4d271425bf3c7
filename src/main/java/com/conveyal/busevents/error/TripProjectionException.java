package com.conveyal.busevents.error;

/**
 * Raised in strict mode, where a single trip that cannot be projected aborts the export instead of being skipped.
 */
public class TripProjectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public final ErrorType errorType;
    public final String badValue;

    public TripProjectionException (ErrorType errorType, String badValue) {
        super(String.format("%s (%s)", errorType.englishMessage, badValue));
        this.errorType = errorType;
        this.badValue = badValue;
    }

}
