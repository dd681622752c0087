package domain.error;

/**
 * A record file does not match its template (row width, column range).
 * Aborts the current table for the current state only.
 */
public class RecordFormatException extends AcsSourceException {

    public RecordFormatException(String message) {
        super(message);
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
