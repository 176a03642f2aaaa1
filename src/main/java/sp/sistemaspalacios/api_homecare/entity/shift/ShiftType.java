package sp.sistemaspalacios.api_homecare.entity.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

public enum ShiftType {
    EFFECTIVE("effective"),
    PRESENCE_DAY("presence_day"),
    PRESENCE_NIGHT("presence_night"),
    GUARD_24H("guard_24h");

    private final String code;

    ShiftType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** Presencia responsable (día o noche): exenta del descanso diario entre tramos. */
    public boolean isPresence() {
        return this == PRESENCE_DAY || this == PRESENCE_NIGHT;
    }

    @JsonCreator
    public static ShiftType fromCode(String code) {
        for (ShiftType type : values()) {
            if (type.code.equalsIgnoreCase(code)) return type;
        }
        throw new InvalidInputException("shiftType", "Type d'intervention inconnu : " + code);
    }
}
