package sp.sistemaspalacios.api_homecare.dto.shift;

import sp.sistemaspalacios.api_homecare.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;

import java.time.LocalDate;
import java.util.List;

/**
 * Guardia de 24h dividida en segmentos ordenados. Cada segmento termina donde empieza
 * el siguiente; el último termina en {@code endTime} del turno.
 */
public record Guard24hShift(
        String id,
        String contractId,
        String employeeId,
        LocalDate date,
        String startTime,
        String endTime,
        int breakDuration,
        ShiftStatus status,
        boolean hasNightAction,
        List<String> tasks,
        List<GuardSegment> guardSegments
) implements Shift {

    public Guard24hShift {
        status = status == null ? ShiftStatus.PLANNED : status;
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        guardSegments = guardSegments == null ? List.of() : List.copyOf(guardSegments);
    }

    @Override
    public ShiftType shiftType() {
        return ShiftType.GUARD_24H;
    }
}
