package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class DailyMaxHoursRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final WeeklyHoursService weeklyHoursService;

    @Override
    public int order() {
        return 50;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        Shift candidate = context.candidateShift();
        List<Shift> shifts = new ArrayList<>(context.siblingShifts());
        shifts.add(candidate);

        double total = weeklyHoursService.dayHours(candidate.employeeId(), candidate.date(), shifts);
        if (total <= agreement.getDailyMaxHours()) return List.of();

        return List.of(ComplianceIssue.error(ComplianceRule.DAILY_MAX_HOURS,
                String.format("Durée maximale quotidienne dépassée le %s : %s au lieu de %s maximum.",
                        ComplianceMessages.day(candidate.date()),
                        ComplianceMessages.hours(total),
                        ComplianceMessages.hours(agreement.getDailyMaxHours()))));
    }
}
