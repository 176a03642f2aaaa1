package sp.sistemaspalacios.api_homecare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import sp.sistemaspalacios.api_homecare.exception.InvalidTimeFormatException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Consumer;

/**
 * Sobrescrituras de {@link LaborAgreement} desde application.yml (prefijo {@code compliance}).
 * Lo que no se declara conserva el valor IDCC 3239.
 */
@Data
@ConfigurationProperties(prefix = "compliance")
public class LaborAgreementProperties {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private Night night = new Night();
    private Rest rest = new Rest();
    private Hours hours = new Hours();
    private Presence presence = new Presence();
    private Guard guard = new Guard();
    private Rates rates = new Rates();

    @Data
    public static class Night {
        private String start;     // "21:00"
        private String end;       // "06:00"
        private Integer requalificationThreshold;
    }

    @Data
    public static class Rest {
        private Double dailyMinHours;
        private Double dailyWarningMarginHours;
        private Double weeklyMinHours;
    }

    @Data
    public static class Hours {
        private Double weeklyWarning;
        private Double weeklyCritical;
        private Double dailyMax;
        private Integer breakRequiredAfterMinutes;
        private Integer minimumBreakMinutes;
    }

    @Data
    public static class Presence {
        private Double nightMaxHours;
        private Integer consecutiveNightsMax;
        private Double dayWeight;
        private Double nightAllowanceFraction;
    }

    @Data
    public static class Guard {
        private Double effectiveMaxHours;
        private Double presenceWarningHours;
        private Double maxAmplitudeHours;
        private Double chainGapHours;
    }

    @Data
    public static class Rates {
        private Double nightMajoration;
        private Double sunday;
        private Double holidayHabitual;
        private Double holidayExceptional;
        private Double overtimeFirstTierHours;
        private Double overtimeFirstTier;
        private Double overtimeBeyond;
    }

    public LaborAgreement toLaborAgreement() {
        LaborAgreement.LaborAgreementBuilder b = LaborAgreement.idcc3239().toBuilder();

        apply(parseTime("compliance.night.start", night.getStart()), b::nightStart);
        apply(parseTime("compliance.night.end", night.getEnd()), b::nightEnd);
        apply(night.getRequalificationThreshold(), b::requalificationThreshold);

        apply(rest.getDailyMinHours(), b::dailyRestMinHours);
        apply(rest.getDailyWarningMarginHours(), b::dailyRestWarningMarginHours);
        apply(rest.getWeeklyMinHours(), b::weeklyRestMinHours);

        apply(hours.getWeeklyWarning(), b::weeklyHoursWarning);
        apply(hours.getWeeklyCritical(), b::weeklyHoursCritical);
        apply(hours.getDailyMax(), b::dailyMaxHours);
        apply(hours.getBreakRequiredAfterMinutes(), b::breakRequiredAfterMinutes);
        apply(hours.getMinimumBreakMinutes(), b::minimumBreakMinutes);

        apply(presence.getNightMaxHours(), b::nightPresenceMaxHours);
        apply(presence.getConsecutiveNightsMax(), b::consecutiveNightsMax);
        apply(presence.getDayWeight(), b::presenceDayWeight);
        apply(presence.getNightAllowanceFraction(), b::nightPresenceAllowanceFraction);

        apply(guard.getEffectiveMaxHours(), b::guardEffectiveMaxHours);
        apply(guard.getPresenceWarningHours(), b::guardPresenceWarningHours);
        apply(guard.getMaxAmplitudeHours(), b::guardMaxAmplitudeHours);
        apply(guard.getChainGapHours(), b::guardChainGapHours);

        apply(rates.getNightMajoration(), b::nightMajorationRate);
        apply(rates.getSunday(), b::sundayRate);
        apply(rates.getHolidayHabitual(), b::holidayHabitualRate);
        apply(rates.getHolidayExceptional(), b::holidayExceptionalRate);
        apply(rates.getOvertimeFirstTierHours(), b::overtimeFirstTierHours);
        apply(rates.getOvertimeFirstTier(), b::overtimeFirstTierRate);
        apply(rates.getOvertimeBeyond(), b::overtimeBeyondRate);

        return b.build();
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) setter.accept(value);
    }

    private static LocalTime parseTime(String key, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalTime.parse(raw.trim(), HH_MM);
        } catch (DateTimeParseException ex) {
            throw new InvalidTimeFormatException(key, raw, ex);
        }
    }
}
