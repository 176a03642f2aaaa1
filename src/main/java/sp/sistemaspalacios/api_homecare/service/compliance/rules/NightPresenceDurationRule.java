package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.shift.PresenceNightShift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.ShiftDurationService;

import java.util.List;

/** Presencia responsable de noche: máximo 12h seguidas (Art. 148 IDCC 3239). */
@Component
@RequiredArgsConstructor
public class NightPresenceDurationRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final ShiftDurationService shiftDurationService;

    @Override
    public int order() {
        return 70;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        if (!(context.candidateShift() instanceof PresenceNightShift night)) return List.of();

        double hours = shiftDurationService.netHours(night);
        if (hours <= agreement.getNightPresenceMaxHours()) return List.of();

        return List.of(ComplianceIssue.error(ComplianceRule.NIGHT_PRESENCE_MAX_DURATION,
                String.format("Présence de nuit trop longue : %s au lieu de %s maximum.",
                        ComplianceMessages.hours(hours),
                        ComplianceMessages.hours(agreement.getNightPresenceMaxHours()))));
    }
}
