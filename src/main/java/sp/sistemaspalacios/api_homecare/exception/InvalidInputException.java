package sp.sistemaspalacios.api_homecare.exception;

/**
 * Entrada mal formada (hora ilegible, pausa negativa, ausencia invertida...).
 * Nunca se usa para violaciones de reglas laborales: esas viajan como
 * {@code ComplianceIssue} dentro del resultado.
 */
public class InvalidInputException extends IllegalArgumentException {

    private final String field;

    public InvalidInputException(String message) {
        super(message);
        this.field = null;
    }

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidInputException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
