package sp.sistemaspalacios.api_homecare.service.shift;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Semana ISO (lunes-domingo) y totales de horas por semana y por día.
 * Un turno pertenece a la semana y al día de su fecha de inicio.
 * El total semanal suma la duración neta de todo turno; el diario solo el trabajo efectivo.
 */
@Service
@RequiredArgsConstructor
public class WeeklyHoursService {

    private static final Locale FR = Locale.FRANCE;
    private static final DateTimeFormatter DAY_MONTH = DateTimeFormatter.ofPattern("d MMMM", FR);
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("d MMMM yyyy", FR);

    private final ShiftDurationService shiftDurationService;
    private final EffectiveHoursService effectiveHoursService;
    private final RequalificationService requalificationService;

    public LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public LocalDate weekEnd(LocalDate date) {
        return weekStart(date).plusDays(6);
    }

    public boolean sameWeek(LocalDate a, LocalDate b) {
        return weekStart(a).equals(weekStart(b));
    }

    /** "Semaine du 2 mars au 8 mars 2026". */
    public String weekLabel(LocalDate anyDay) {
        LocalDate start = weekStart(anyDay);
        return "Semaine du " + start.format(DAY_MONTH) + " au " + start.plusDays(6).format(DAY_MONTH_YEAR);
    }

    public double weekHours(String employeeId, LocalDate anyDay, Collection<? extends Shift> shifts) {
        LocalDate start = weekStart(anyDay);
        long minutes = shifts.stream()
                .filter(s -> Objects.equals(s.employeeId(), employeeId))
                .filter(s -> weekStart(s.date()).equals(start))
                .mapToLong(shiftDurationService::netMinutes)
                .sum();
        return minutes / 60.0;
    }

    /**
     * Trabajo efectivo del día: duración neta de los turnos effective, segmentos efectivos de
     * las guardias, presencia nocturna solo si está recalificada y presencia diurna a 2/3.
     */
    public double dayHours(String employeeId, LocalDate day, Collection<? extends Shift> shifts) {
        return shifts.stream()
                .filter(s -> Objects.equals(s.employeeId(), employeeId))
                .filter(s -> day.equals(s.date()))
                .mapToDouble(this::effectiveWorkHours)
                .sum();
    }

    private double effectiveWorkHours(Shift shift) {
        return switch (shift.shiftType()) {
            case EFFECTIVE -> shiftDurationService.netMinutes(shift) / 60.0;
            case PRESENCE_DAY, PRESENCE_NIGHT, GUARD_24H -> effectiveHoursService
                    .computeEffectiveHours(shift, requalificationService.isRequalified(shift))
                    .map(BigDecimal::doubleValue)
                    .orElse(0.0);
        };
    }
}
