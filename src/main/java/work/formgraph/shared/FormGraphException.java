package work.formgraph.shared;

/**
 * Base for every error raised by the engine. Carries a stable machine-readable code next to the message.
 */
public class FormGraphException extends RuntimeException {
    private final String code;

    public FormGraphException(String code, String message) {
        super(message);
        this.code = code;
    }

    public FormGraphException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
