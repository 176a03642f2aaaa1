package sp.sistemaspalacios.api_homecare.exception;

public class InvalidTimeFormatException extends InvalidInputException {

    private final String rawValue;

    public InvalidTimeFormatException(String rawValue) {
        this("time", rawValue, null);
    }

    public InvalidTimeFormatException(String field, String rawValue, Throwable cause) {
        super(field, "Heure invalide (HH:mm attendu) : " + rawValue, cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
