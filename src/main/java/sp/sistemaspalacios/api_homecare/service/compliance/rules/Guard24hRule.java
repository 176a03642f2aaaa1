package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.shift.Guard24hShift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.EffectiveHoursService;

import java.util.List;

/**
 * Guardia de 24h: máximo de horas efectivas (bloqueante) y aviso si un segmento de
 * presencia supera el umbral.
 */
@Component
@RequiredArgsConstructor
public class Guard24hRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final EffectiveHoursService effectiveHoursService;

    @Override
    public int order() {
        return 90;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        if (!(context.candidateShift() instanceof Guard24hShift guard)) return List.of();

        if (guard.guardSegments().isEmpty()) {
            return List.of(ComplianceIssue.error(ComplianceRule.GUARD_24H_EFFECTIVE_MAX,
                    "Une garde 24h doit être découpée en segments (effectif / présence)."));
        }

        EffectiveHoursService.GuardBreakdown breakdown = effectiveHoursService.guardBreakdown(guard);
        double effectiveHours = breakdown.effectiveMinutes() / 60.0;
        if (effectiveHours > agreement.getGuardEffectiveMaxHours()) {
            return List.of(ComplianceIssue.error(ComplianceRule.GUARD_24H_EFFECTIVE_MAX,
                    String.format("Garde 24h : %s de travail effectif au lieu de %s maximum.",
                            ComplianceMessages.hours(effectiveHours),
                            ComplianceMessages.hours(agreement.getGuardEffectiveMaxHours()))));
        }

        double longestPresence = breakdown.longestPresenceSegmentMinutes() / 60.0;
        if (longestPresence > agreement.getGuardPresenceWarningHours()) {
            return List.of(ComplianceIssue.warning(ComplianceRule.GUARD_24H_EFFECTIVE_MAX,
                    String.format("Garde 24h : segment de présence de %s (au-delà de %s recommandées).",
                            ComplianceMessages.hours(longestPresence),
                            ComplianceMessages.hours(agreement.getGuardPresenceWarningHours()))));
        }
        return List.of();
    }
}
