package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.ShiftDurationService;

import java.util.List;

/**
 * Pausa mínima pasado cierto tiempo de trabajo continuo. Solo aviso.
 * Aplica al trabajo efectivo; las guardias llevan sus pausas por segmento.
 */
@Component
@RequiredArgsConstructor
public class MandatoryBreakRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final ShiftDurationService shiftDurationService;

    @Override
    public int order() {
        return 60;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        Shift shift = context.candidateShift();
        if (shift.shiftType() != ShiftType.EFFECTIVE) return List.of();

        int raw = shiftDurationService.rawMinutes(shift);
        if (raw <= agreement.getBreakRequiredAfterMinutes()
                || shift.breakDuration() >= agreement.getMinimumBreakMinutes()) {
            return List.of();
        }

        return List.of(ComplianceIssue.warning(ComplianceRule.MANDATORY_BREAK,
                String.format("Pause insuffisante : %d min pour une intervention de %s. "
                                + "Une pause de %d min minimum est obligatoire au-delà de %s de travail.",
                        shift.breakDuration(), ComplianceMessages.hours(raw / 60.0),
                        agreement.getMinimumBreakMinutes(),
                        ComplianceMessages.hours(agreement.getBreakRequiredAfterMinutes() / 60.0))));
    }
}
