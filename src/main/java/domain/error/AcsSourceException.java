package domain.error;

/**
 * Base type for failures caused by the Summary File inputs themselves
 * (metadata, templates, record files, archives).
 *
 * <p>Unchecked: callers decide at which level (run / state / table) to stop.</p>
 */
public class AcsSourceException extends RuntimeException {

    public AcsSourceException(String message) {
        super(message);
    }

    public AcsSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
