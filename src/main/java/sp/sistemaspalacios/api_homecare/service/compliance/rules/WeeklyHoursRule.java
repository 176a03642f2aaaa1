package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;

import java.util.ArrayList;
import java.util.List;

/**
 * Total de horas netas de la semana ISO con el candidato incluido.
 * Los umbrales globales (44h aviso, 48h error) no dependen del contrato; superar
 * las horas contractuales solo añade un aviso de horas extra.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeeklyHoursRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final WeeklyHoursService weeklyHoursService;

    @Override
    public int order() {
        return 40;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        Shift candidate = context.candidateShift();
        List<Shift> shifts = new ArrayList<>(context.siblingShifts());
        shifts.add(candidate);

        double total = weeklyHoursService.weekHours(candidate.employeeId(), candidate.date(), shifts);
        log.debug("📊 Semana de {}: {}h", candidate.employeeId(), total);

        List<ComplianceIssue> issues = new ArrayList<>();
        if (total >= agreement.getWeeklyHoursCritical()) {
            issues.add(ComplianceIssue.error(ComplianceRule.WEEKLY_MAX_HOURS,
                    String.format("Durée maximale hebdomadaire atteinte : %s (maximum %s).",
                            ComplianceMessages.hours(total),
                            ComplianceMessages.hours(agreement.getWeeklyHoursCritical()))));
        } else if (total > agreement.getWeeklyHoursWarning()) {
            issues.add(ComplianceIssue.warning(ComplianceRule.WEEKLY_MAX_HOURS,
                    String.format("Attention : %s cette semaine (seuil d'alerte %s).",
                            ComplianceMessages.hours(total),
                            ComplianceMessages.hours(agreement.getWeeklyHoursWarning()))));
        }

        ContractDTO contract = context.getContract();
        if (contract == null || contract.getWeeklyHours() == null) {
            context.markNotEvaluated(ComplianceRule.CONTRACT_HOURS_EXCEEDED,
                    "Durée contractuelle hebdomadaire inconnue");
        } else if (total > contract.getWeeklyHours()) {
            issues.add(ComplianceIssue.warning(ComplianceRule.CONTRACT_HOURS_EXCEEDED,
                    String.format("%s cette semaine pour un contrat de %s : %s d'heures supplémentaires.",
                            ComplianceMessages.hours(total),
                            ComplianceMessages.hours(contract.getWeeklyHours()),
                            ComplianceMessages.hours(total - contract.getWeeklyHours()))));
        }
        return issues;
    }
}
