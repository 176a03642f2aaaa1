package sp.sistemaspalacios.api_homecare.service.common;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.exception.InvalidTimeFormatException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

@Service
public class TimeService {

    // Solo 24h: "HH:mm"
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static final int MINUTES_PER_DAY = 24 * 60;

    /** Convierte LocalTime a minutos desde 00:00. */
    public int toMinutes(LocalTime t) {
        return t.getHour() * 60 + t.getMinute();
    }

    public int normalizeMinutes(int minutes) {
        int m = minutes % MINUTES_PER_DAY;
        return m < 0 ? m + MINUTES_PER_DAY : m;
    }

    /** Parsea "HH:mm" estrictamente. */
    public LocalTime parse(String hhmm) {
        return parse("time", hhmm);
    }

    public LocalTime parse(String field, String hhmm) {
        if (hhmm == null) throw new InvalidTimeFormatException(field, null, null);
        try {
            return LocalTime.parse(hhmm.trim(), HH_MM);
        } catch (DateTimeParseException ex) {
            throw new InvalidTimeFormatException(field, hhmm, ex);
        }
    }

    /** Minutos desde 00:00 de una hora "HH:mm". */
    public int parseToMinutes(String hhmm) {
        return toMinutes(parse(hhmm));
    }

    /** Formatea a "HH:mm". */
    public String format(LocalTime t) {
        return (t == null) ? null : t.format(HH_MM);
    }
}
