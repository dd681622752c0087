package domain.error;

/** A sequence referenced by the appendix has no column-name template. */
public class MissingTemplateException extends AcsSourceException {

    private final String templateKey;

    public MissingTemplateException(String templateKey) {
        super("No template for sequence: " + templateKey);
        this.templateKey = templateKey;
    }

    public MissingTemplateException(String templateKey, String message, Throwable cause) {
        super(message, cause);
        this.templateKey = templateKey;
    }

    public String getTemplateKey() {
        return templateKey;
    }
}
