package sp.sistemaspalacios.api_homecare.service.shift;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Duración neta de un turno en minutos: (fin − inicio) − pausa, nunca negativa.
 */
@Service
@RequiredArgsConstructor
public class ShiftDurationService {

    private final WorkingTimeCalculatorService workingTimeCalculator;

    public int calculateShiftDuration(String startTime, String endTime, int breakMinutes) {
        if (breakMinutes < 0) {
            throw new InvalidInputException("breakDuration", "La pause ne peut pas être négative : " + breakMinutes);
        }
        int raw = workingTimeCalculator.rawMinutes(startTime, endTime);
        return Math.max(0, raw - breakMinutes);
    }

    public int netMinutes(Shift shift) {
        return calculateShiftDuration(shift.startTime(), shift.endTime(), shift.breakDuration());
    }

    /** Duración bruta, sin descontar la pausa. */
    public int rawMinutes(Shift shift) {
        return workingTimeCalculator.rawMinutes(shift.startTime(), shift.endTime());
    }

    public double netHours(Shift shift) {
        return netMinutes(shift) / 60.0;
    }

    /** Horas con 2 decimales para la respuesta. */
    public static BigDecimal toHours(double hours) {
        return BigDecimal.valueOf(hours).setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal minutesToHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP);
    }
}
