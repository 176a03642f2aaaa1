package sp.sistemaspalacios.api_homecare.entity.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

public enum ShiftStatus {
    PLANNED("planned"),
    COMPLETED("completed");

    private final String code;

    ShiftStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ShiftStatus fromCode(String code) {
        for (ShiftStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) return status;
        }
        throw new InvalidInputException("status", "Statut d'intervention inconnu : " + code);
    }
}
