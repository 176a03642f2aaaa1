package sp.sistemaspalacios.api_homecare.entity.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

public enum GuardSegmentType {
    EFFECTIVE("effective"),
    PRESENCE("presence");

    private final String code;

    GuardSegmentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static GuardSegmentType fromCode(String code) {
        for (GuardSegmentType type : values()) {
            if (type.code.equalsIgnoreCase(code)) return type;
        }
        throw new InvalidInputException("guardSegments.type", "Type de segment inconnu : " + code);
    }
}
