package sp.sistemaspalacios.api_homecare.entity.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Estado agregado de un empleado en la vista semanal.
 * El orden de declaración es el orden de presentación (más grave primero).
 */
public enum ComplianceLevel {
    CRITICAL("critical"),
    WARNING("warning"),
    OK("ok");

    private final String code;

    ComplianceLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ComplianceLevel fromSeverity(Severity severity) {
        return severity == Severity.ERROR ? CRITICAL : WARNING;
    }
}
