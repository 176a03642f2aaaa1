package sp.sistemaspalacios.api_homecare.entity.absence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

public enum AbsenceStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String code;

    AbsenceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AbsenceStatus fromCode(String code) {
        for (AbsenceStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) return status;
        }
        throw new InvalidInputException("status", "Statut d'absence inconnu : " + code);
    }
}
