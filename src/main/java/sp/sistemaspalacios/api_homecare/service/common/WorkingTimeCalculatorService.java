package sp.sistemaspalacios.api_homecare.service.common;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Línea de tiempo absoluta para turnos. Es el único sitio que resuelve el cruce
 * de medianoche: duración, horas nocturnas y huecos de descanso se calculan
 * sobre {@link Interval}.
 */
@Service
@RequiredArgsConstructor
public class WorkingTimeCalculatorService {

    private final TimeService timeService;

    // ÚNICA definición del record
    public record Interval(LocalDateTime start, LocalDateTime end) {

        public long minutes() {
            return Duration.between(start, end).toMinutes();
        }

        public boolean overlaps(Interval other) {
            return start.isBefore(other.end) && other.start.isBefore(end);
        }

        /** Minutos compartidos con otro intervalo (0 si no se tocan). */
        public long overlapMinutes(Interval other) {
            LocalDateTime s = start.isAfter(other.start) ? start : other.start;
            LocalDateTime e = end.isBefore(other.end) ? end : other.end;
            return e.isAfter(s) ? Duration.between(s, e).toMinutes() : 0;
        }

        /** Recorta el intervalo a [from, to); null si queda vacío. */
        public Interval clip(LocalDateTime from, LocalDateTime to) {
            LocalDateTime s = start.isBefore(from) ? from : start;
            LocalDateTime e = end.isAfter(to) ? to : end;
            return e.isAfter(s) ? new Interval(s, e) : null;
        }
    }

    /** Duración bruta en minutos soportando cruce de medianoche (fin ≤ inicio ⇒ +24h). */
    public int rawMinutes(LocalTime start, LocalTime end) {
        int s = timeService.toMinutes(start);
        int e = timeService.toMinutes(end);
        int diff = e - s;
        if (diff <= 0) diff += TimeService.MINUTES_PER_DAY;
        return diff;
    }

    public int rawMinutes(String start, String end) {
        return rawMinutes(timeService.parse("startTime", start), timeService.parse("endTime", end));
    }

    /** Ancla un tramo horario al día indicado; el fin pasa al día siguiente si hace falta. */
    public Interval anchor(LocalDate date, LocalTime start, LocalTime end) {
        LocalDateTime s = date.atTime(start);
        return new Interval(s, s.plusMinutes(rawMinutes(start, end)));
    }

    public Interval anchor(LocalDate date, String start, String end) {
        return anchor(date, timeService.parse("startTime", start), timeService.parse("endTime", end));
    }

    public Interval anchor(Shift shift) {
        return anchor(shift.date(), shift.startTime(), shift.endTime());
    }

    /** Minutos entre el fin de {@code before} y el inicio de {@code after} (negativo si solapan). */
    public long gapMinutes(Interval before, Interval after) {
        return Duration.between(before.end(), after.start()).toMinutes();
    }

    public boolean overlaps(Interval a, Interval b) {
        return a.overlaps(b);
    }
}
