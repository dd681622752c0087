package domain.error;

/**
 * Appendix metadata is missing a required field or has an unparsable range.
 * Fatal to the whole run.
 */
public class MalformedMetadataException extends AcsSourceException {

    public MalformedMetadataException(String message) {
        super(message);
    }

    public MalformedMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
