package sp.sistemaspalacios.api_homecare.dto.shift;

import sp.sistemaspalacios.api_homecare.entity.shift.ShiftStatus;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;

import java.time.LocalDate;
import java.util.List;

public record EffectiveShift(
        String id,
        String contractId,
        String employeeId,
        LocalDate date,
        String startTime,
        String endTime,
        int breakDuration,
        ShiftStatus status,
        boolean hasNightAction,
        List<String> tasks
) implements Shift {

    public EffectiveShift {
        status = status == null ? ShiftStatus.PLANNED : status;
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    @Override
    public ShiftType shiftType() {
        return ShiftType.EFFECTIVE;
    }
}
