package sp.sistemaspalacios.api_homecare.service.shift;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.shift.Guard24hShift;
import sp.sistemaspalacios.api_homecare.dto.shift.GuardSegment;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.shift.GuardSegmentType;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;
import sp.sistemaspalacios.api_homecare.service.common.TimeService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ponderación de horas por tipo de turno (IDCC 3239):
 * <ul>
 *   <li>effective: sin conversión, vacío (no aplica)</li>
 *   <li>presence_day: duración × 2/3 (Art. 137.1)</li>
 *   <li>presence_night recalificada: duración × 1; sin recalificar: vacío (indemnización a tanto alzado)</li>
 *   <li>guard_24h: suma de los segmentos efectivos menos sus pausas</li>
 * </ul>
 * Solo se redondea al final, a 2 decimales.
 */
@Service
@RequiredArgsConstructor
public class EffectiveHoursService {

    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

    private final ShiftDurationService shiftDurationService;
    private final TimeService timeService;
    private final LaborAgreement agreement;

    /** Reparto de una guardia en minutos efectivos y de presencia. */
    public record GuardBreakdown(long effectiveMinutes, long presenceMinutes, long longestPresenceSegmentMinutes) {
    }

    public Optional<BigDecimal> computeEffectiveHours(Shift shift, boolean isRequalified) {
        return switch (shift.shiftType()) {
            case EFFECTIVE -> Optional.empty();
            case PRESENCE_DAY -> Optional.of(round(
                    minutesToHours(shiftDurationService.netMinutes(shift))
                            .multiply(BigDecimal.valueOf(agreement.getPresenceDayWeight()))));
            case PRESENCE_NIGHT -> isRequalified
                    ? Optional.of(round(minutesToHours(shiftDurationService.netMinutes(shift))))
                    : Optional.empty();
            case GUARD_24H -> {
                Guard24hShift guard = (Guard24hShift) shift;
                if (guard.guardSegments().isEmpty()) yield Optional.empty();
                yield Optional.of(round(minutesToHours(guardBreakdown(guard).effectiveMinutes())));
            }
        };
    }

    /**
     * Cada segmento termina donde empieza el siguiente. El último cierra el ciclo: continúa
     * hasta el fin del turno y retoma desde su inicio hasta el primer segmento, de modo que
     * la guardia entera queda repartida. Los inicios se miden desde el inicio del turno y
     * deben ser estrictamente crecientes.
     */
    public GuardBreakdown guardBreakdown(Guard24hShift guard) {
        List<GuardSegment> segments = guard.guardSegments();
        int guardStart = timeService.parseToMinutes(guard.startTime());
        int guardLength = shiftDurationService.rawMinutes(guard);

        List<Integer> offsets = new ArrayList<>(segments.size());
        for (GuardSegment segment : segments) {
            if (segment.breakMinutes() < 0) {
                throw new InvalidInputException("guardSegments.breakMinutes",
                        "La pause d'un segment ne peut pas être négative : " + segment.breakMinutes());
            }
            int offset = timeService.normalizeMinutes(timeService.parseToMinutes(segment.startTime()) - guardStart);
            if (!offsets.isEmpty() && offset <= offsets.get(offsets.size() - 1)) {
                throw new InvalidInputException("guardSegments",
                        "Les segments de garde doivent être ordonnés chronologiquement (" + segment.startTime() + ")");
            }
            if (offset >= guardLength) {
                throw new InvalidInputException("guardSegments",
                        "Le segment " + segment.startTime() + " commence après la fin de la garde");
            }
            offsets.add(offset);
        }

        long effective = 0;
        long presence = 0;
        long longestPresence = 0;
        for (int i = 0; i < segments.size(); i++) {
            GuardSegment segment = segments.get(i);
            int end = (i + 1 < offsets.size()) ? offsets.get(i + 1) : guardLength + offsets.get(0);
            int length = end - offsets.get(i);

            if (segment.type() == GuardSegmentType.EFFECTIVE) {
                effective += Math.max(0, length - segment.breakMinutes());
            } else {
                presence += length;
                longestPresence = Math.max(longestPresence, length);
            }
        }
        return new GuardBreakdown(effective, presence, longestPresence);
    }

    private static BigDecimal minutesToHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(SIXTY, 10, RoundingMode.HALF_UP);
    }

    private static BigDecimal round(BigDecimal hours) {
        return hours.setScale(2, RoundingMode.HALF_UP);
    }
}
