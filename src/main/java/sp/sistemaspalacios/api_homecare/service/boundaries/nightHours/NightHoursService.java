package sp.sistemaspalacios.api_homecare.service.boundaries.nightHours;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService.Interval;

import java.time.LocalDate;

/**
 * Horas de un turno que caen dentro de la ventana nocturna legal.
 *
 * <p>La ventana puede cruzar medianoche (21:00-06:00), así que se evalúan las
 * ventanas ancladas al día anterior, al propio día y al siguiente: un turno
 * 02:00-05:00 cae en la noche que empezó la víspera.</p>
 *
 * <p>Una hora ilegible lanza {@code InvalidTimeFormatException}; ningún
 * llamador la convierte en 0.</p>
 */
@Service
@RequiredArgsConstructor
public class NightHoursService {

    private final WorkingTimeCalculatorService workingTimeCalculator;
    private final LaborAgreement agreement;

    public long calculateNightMinutes(LocalDate date, String startTime, String endTime) {
        Interval shift = workingTimeCalculator.anchor(date, startTime, endTime);

        long total = 0;
        for (int offset = -1; offset <= 1; offset++) {
            Interval window = nightWindow(date.plusDays(offset));
            total += shift.overlapMinutes(window);
        }
        return total;
    }

    public double calculateNightHours(LocalDate date, String startTime, String endTime) {
        return calculateNightMinutes(date, startTime, endTime) / 60.0;
    }

    public double calculateNightHours(Shift shift) {
        return calculateNightHours(shift.date(), shift.startTime(), shift.endTime());
    }

    /** Ventana nocturna que empieza el día indicado. */
    private Interval nightWindow(LocalDate day) {
        return workingTimeCalculator.anchor(day, agreement.getNightStart(), agreement.getNightEnd());
    }
}
