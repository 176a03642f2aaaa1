package sp.sistemaspalacios.api_homecare.service.boundaries.holiday;

import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Festivos franceses: fechas fijas más los que dependen de Pascua.
 */
@Service
public class PublicHolidayService {

    private final ConcurrentMap<Integer, Set<LocalDate>> cache = new ConcurrentHashMap<>();

    public boolean isPublicHoliday(LocalDate date) {
        return holidaysOf(date.getYear()).contains(date);
    }

    public boolean isSunday(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    public Set<LocalDate> holidaysOf(int year) {
        return cache.computeIfAbsent(year, PublicHolidayService::computeHolidays);
    }

    private static Set<LocalDate> computeHolidays(int year) {
        LocalDate easter = easterSunday(year);
        return Set.of(
                LocalDate.of(year, Month.JANUARY, 1),    // Jour de l'an
                LocalDate.of(year, Month.MAY, 1),        // Fête du travail
                LocalDate.of(year, Month.MAY, 8),        // Victoire 1945
                LocalDate.of(year, Month.JULY, 14),      // Fête nationale
                LocalDate.of(year, Month.AUGUST, 15),    // Assomption
                LocalDate.of(year, Month.NOVEMBER, 1),   // Toussaint
                LocalDate.of(year, Month.NOVEMBER, 11),  // Armistice
                LocalDate.of(year, Month.DECEMBER, 25),  // Noël
                easter,
                easter.plusDays(1),                      // Lundi de Pâques
                easter.plusDays(39),                     // Ascension
                easter.plusDays(50)                      // Lundi de Pentecôte
        );
    }

    /** Domingo de Pascua (algoritmo de Butcher-Meeus). */
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
