package sp.sistemaspalacios.api_homecare.entity.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/** Errores bloquean la validación del turno; avisos solo se muestran. */
public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
