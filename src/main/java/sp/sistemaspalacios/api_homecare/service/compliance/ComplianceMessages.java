package sp.sistemaspalacios.api_homecare.service.compliance;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Formato de cifras y fechas en los mensajes (en francés, como los ve el empleador). */
public final class ComplianceMessages {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("d MMMM", Locale.FRANCE);
    private static final DateTimeFormatter DAY_AT = DateTimeFormatter.ofPattern("EEEE d MMMM 'à' HH:mm", Locale.FRANCE);

    private ComplianceMessages() {
    }

    public static String hours(double hours) {
        return String.format(Locale.FRANCE, "%.1fh", hours);
    }

    public static String day(LocalDate date) {
        return date.format(DAY);
    }

    public static String dayAt(LocalDateTime dateTime) {
        return dateTime.format(DAY_AT);
    }
}
