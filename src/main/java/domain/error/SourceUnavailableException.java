package domain.error;

/** An expected source file or archive member is absent or unreadable. */
public class SourceUnavailableException extends AcsSourceException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
