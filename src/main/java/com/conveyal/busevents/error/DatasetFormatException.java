package com.conveyal.busevents.error;

/**
 * Thrown when the structure of a source dataset cannot be understood, for example when a section has the wrong JSON
 * type or an identifier is not an integer. Unlike the problems described by {@link ErrorType}, this is fatal for the
 * whole operation: no partial dataset is ever returned.
 */
public class DatasetFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** JSON pointer-like location of the offending value, e.g. "/42/getstopsbyvar/101". */
    public final String location;

    public DatasetFormatException (String location, String message) {
        super(String.format("%s: %s", location, message));
        this.location = location;
    }

    /** Wraps unexpected exceptions thrown while reading the dataset. */
    public DatasetFormatException (String location, Exception ex) {
        super(String.format("%s: %s", location, ex.getMessage()), ex);
        this.location = location;
    }

}
