package sp.sistemaspalacios.api_homecare.dto.shift;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;

import java.time.LocalDate;
import java.util.List;

/**
 * Intervención de un auxiliar para un contrato. Cada variante solo lleva los campos
 * que tienen sentido para su tipo: el número de intervenciones nocturnas solo existe
 * en {@link PresenceNightShift} y los segmentos solo en {@link Guard24hShift}.
 *
 * <p>{@code endTime} anterior o igual a {@code startTime} significa que el turno
 * termina al día siguiente.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "shiftType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EffectiveShift.class, name = "effective"),
        @JsonSubTypes.Type(value = PresenceDayShift.class, name = "presence_day"),
        @JsonSubTypes.Type(value = PresenceNightShift.class, name = "presence_night"),
        @JsonSubTypes.Type(value = Guard24hShift.class, name = "guard_24h")
})
public sealed interface Shift permits EffectiveShift, PresenceDayShift, PresenceNightShift, Guard24hShift {

    String id();

    String contractId();

    String employeeId();

    /** Día natural en el que empieza el turno. */
    LocalDate date();

    String startTime();

    String endTime();

    /** Minutos de pausa, nunca negativos. */
    int breakDuration();

    ShiftStatus status();

    boolean hasNightAction();

    List<String> tasks();

    ShiftType shiftType();

    @JsonIgnore
    default boolean isPresence() {
        return shiftType().isPresence();
    }
}
