package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Amplitud de una guardia encadenada. Dos turnos se encadenan si el hueco entre ellos
 * no supera el umbral y al menos uno es de presencia; la cadena que contiene al
 * candidato no puede pasar de 24h de principio a fin.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardAmplitudeRule implements ShiftRule {

    private final LaborAgreement agreement;

    @Override
    public int order() {
        return 100;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        List<RuleContext.AnchoredShift> all = context.withCandidate();
        long maxGap = Math.round(agreement.getGuardChainGapHours() * 60);

        List<RuleContext.AnchoredShift> chain = new ArrayList<>();
        List<RuleContext.AnchoredShift> candidateChain = null;
        for (RuleContext.AnchoredShift current : all) {
            if (!chain.isEmpty()) {
                RuleContext.AnchoredShift previous = chain.get(chain.size() - 1);
                long gap = Duration.between(previous.interval().end(), current.interval().start()).toMinutes();
                boolean chained = gap <= maxGap && (previous.shift().isPresence() || current.shift().isPresence());
                if (!chained) {
                    if (chain.contains(context.getCandidate())) candidateChain = chain;
                    chain = new ArrayList<>();
                }
            }
            chain.add(current);
        }
        if (candidateChain == null) candidateChain = chain;

        if (candidateChain.size() < 2) return List.of();

        double amplitude = Duration.between(
                candidateChain.get(0).interval().start(),
                candidateChain.get(candidateChain.size() - 1).interval().end()).toMinutes() / 60.0;
        if (amplitude <= agreement.getGuardMaxAmplitudeHours()) return List.of();

        log.debug("⏱️ Cadena de {} turnos con amplitud {}h", candidateChain.size(), amplitude);
        return List.of(ComplianceIssue.error(ComplianceRule.GUARD_MAX_AMPLITUDE,
                String.format("Amplitude de garde de %s (effectif + présence) au lieu de %s maximum.",
                        ComplianceMessages.hours(amplitude),
                        ComplianceMessages.hours(agreement.getGuardMaxAmplitudeHours()))));
    }
}
