package sp.sistemaspalacios.api_homecare.config;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * Umbrales del convenio colectivo que usa el motor de conformidad.
 * Inmutable: se construye una vez al arrancar y se pasa a cada servicio.
 *
 * <p>Los valores por defecto corresponden a la convención IDCC 3239
 * (particuliers employeurs et emploi à domicile).</p>
 */
@Value
@Builder(toBuilder = true)
public class LaborAgreement {

    // Ventana nocturna (cruza medianoche)
    @Builder.Default LocalTime nightStart = LocalTime.of(21, 0);
    @Builder.Default LocalTime nightEnd = LocalTime.of(6, 0);

    // Recalificación de presencia nocturna
    @Builder.Default int requalificationThreshold = 4;

    // Descansos
    @Builder.Default double dailyRestMinHours = 11;
    @Builder.Default double dailyRestWarningMarginHours = 1;
    @Builder.Default double weeklyRestMinHours = 35;

    // Topes de horas
    @Builder.Default double weeklyHoursWarning = 44;
    @Builder.Default double weeklyHoursCritical = 48;
    @Builder.Default double dailyMaxHours = 10;

    // Pausa obligatoria
    @Builder.Default int breakRequiredAfterMinutes = 6 * 60;
    @Builder.Default int minimumBreakMinutes = 20;

    // Presencia nocturna y guardias
    @Builder.Default double nightPresenceMaxHours = 12;
    @Builder.Default int consecutiveNightsMax = 5;
    @Builder.Default double guardEffectiveMaxHours = 12;
    @Builder.Default double guardPresenceWarningHours = 12;
    @Builder.Default double guardMaxAmplitudeHours = 24;
    @Builder.Default double guardChainGapHours = 2;

    // Ponderaciones y recargos
    @Builder.Default double nightMajorationRate = 0.20;
    @Builder.Default double presenceDayWeight = 2.0 / 3.0;
    @Builder.Default double nightPresenceAllowanceFraction = 0.25;
    @Builder.Default double sundayRate = 0.30;
    @Builder.Default double holidayHabitualRate = 0.60;
    @Builder.Default double holidayExceptionalRate = 1.00;
    @Builder.Default double overtimeFirstTierHours = 8;
    @Builder.Default double overtimeFirstTierRate = 0.25;
    @Builder.Default double overtimeBeyondRate = 0.50;

    /** Valores de la convención IDCC 3239. */
    public static LaborAgreement idcc3239() {
        return LaborAgreement.builder().build();
    }
}
