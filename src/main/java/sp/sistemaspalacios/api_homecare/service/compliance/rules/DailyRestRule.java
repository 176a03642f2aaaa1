package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Descanso diario entre el turno anterior y el candidato, y entre el candidato y el
 * siguiente. Por debajo del mínimo es error; dentro del margen, aviso.
 * La presencia responsable a uno u otro lado queda exenta (Art. 137.1 / 148 IDCC 3239).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyRestRule implements ShiftRule {

    private final LaborAgreement agreement;

    @Override
    public int order() {
        return 20;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        List<ComplianceIssue> issues = new ArrayList<>();
        RuleContext.AnchoredShift candidate = context.getCandidate();

        findPrevious(context).ifPresent(previous ->
                check(previous, candidate, false).ifPresent(issues::add));
        findNext(context).ifPresent(next ->
                check(candidate, next, true).ifPresent(issues::add));

        return issues;
    }

    public Optional<RuleContext.AnchoredShift> findPrevious(RuleContext context) {
        LocalDateTime start = context.candidateInterval().start();
        return context.getSiblings().stream()
                .filter(s -> !s.interval().end().isAfter(start))
                .max(Comparator.comparing(s -> s.interval().end()));
    }

    public Optional<RuleContext.AnchoredShift> findNext(RuleContext context) {
        LocalDateTime end = context.candidateInterval().end();
        return context.getSiblings().stream()
                .filter(s -> !s.interval().start().isBefore(end))
                .min(Comparator.comparing(s -> s.interval().start()));
    }

    private Optional<ComplianceIssue> check(RuleContext.AnchoredShift before,
                                            RuleContext.AnchoredShift after,
                                            boolean candidateIsBefore) {
        if (before.shift().isPresence() || after.shift().isPresence()) {
            return Optional.empty();
        }

        double restHours = Duration.between(before.interval().end(), after.interval().start()).toMinutes() / 60.0;
        RuleContext.AnchoredShift other = candidateIsBefore ? after : before;
        double minimum = agreement.getDailyRestMinHours();

        if (restHours < minimum) {
            LocalDateTime earliest = before.interval().end().plusMinutes(Math.round(minimum * 60));
            log.debug("😴 Descanso diario {}h < {}h frente al turno {}", restHours, minimum, other.shift().id());
            String message = candidateIsBefore
                    ? String.format("Le repos avant l'intervention suivante (%s à %s) serait insuffisant : %s au lieu de %s minimum.",
                            ComplianceMessages.day(after.shift().date()), after.shift().startTime(),
                            ComplianceMessages.hours(restHours), ComplianceMessages.hours(minimum))
                    : String.format("Repos quotidien insuffisant : %s au lieu de %s minimum. L'intervention ne peut pas commencer avant %s.",
                            ComplianceMessages.hours(restHours), ComplianceMessages.hours(minimum),
                            ComplianceMessages.dayAt(earliest));
            return Optional.of(ComplianceIssue.error(ComplianceRule.DAILY_REST, message, other.shift().id()));
        }

        if (restHours < minimum + agreement.getDailyRestWarningMarginHours()) {
            return Optional.of(ComplianceIssue.warning(ComplianceRule.DAILY_REST,
                    String.format("Repos quotidien juste suffisant : %s (minimum %s).",
                            ComplianceMessages.hours(restHours), ComplianceMessages.hours(minimum)),
                    other.shift().id()));
        }
        return Optional.empty();
    }
}
