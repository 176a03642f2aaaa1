package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Noches seguidas de presencia responsable, contando hacia atrás y hacia delante
 * desde la fecha del candidato.
 */
@Component
@RequiredArgsConstructor
public class ConsecutiveNightsRule implements ShiftRule {

    private final LaborAgreement agreement;

    @Override
    public int order() {
        return 80;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        Shift candidate = context.candidateShift();
        if (candidate.shiftType() != ShiftType.PRESENCE_NIGHT) return List.of();

        int count = countConsecutiveNights(candidate.date(), context.siblingShifts());
        if (count <= agreement.getConsecutiveNightsMax()) return List.of();

        return List.of(ComplianceIssue.error(ComplianceRule.CONSECUTIVE_NIGHTS_MAX,
                String.format("%d nuits consécutives de présence responsable (maximum %d).",
                        count, agreement.getConsecutiveNightsMax())));
    }

    public int countConsecutiveNights(LocalDate date, List<Shift> siblings) {
        Set<LocalDate> nights = siblings.stream()
                .filter(s -> s.shiftType() == ShiftType.PRESENCE_NIGHT)
                .map(Shift::date)
                .collect(Collectors.toSet());

        int count = 1;
        for (LocalDate d = date.minusDays(1); nights.contains(d); d = d.minusDays(1)) count++;
        for (LocalDate d = date.plusDays(1); nights.contains(d); d = d.plusDays(1)) count++;
        return count;
    }
}
