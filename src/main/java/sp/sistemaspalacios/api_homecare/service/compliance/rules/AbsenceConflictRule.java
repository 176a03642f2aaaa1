package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService.Interval;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ninguna intervención durante una ausencia aprobada. Las ausencias pendientes o
 * rechazadas no bloquean. El rango de días es inclusivo.
 */
@Slf4j
@Component
public class AbsenceConflictRule implements ShiftRule {

    @Override
    public int order() {
        return 15;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        List<ComplianceIssue> issues = new ArrayList<>();
        String employeeId = context.candidateShift().employeeId();

        for (AbsenceDTO absence : context.getAbsences()) {
            if (!absence.isApproved()) continue;
            if (!Objects.equals(absence.getEmployeeId(), employeeId)) continue;

            Interval range = new Interval(
                    absence.getStartDate().atStartOfDay(),
                    absence.getEndDate().plusDays(1).atStartOfDay());
            if (!range.overlaps(context.candidateInterval())) continue;

            log.debug("🚫 Turno dentro de la ausencia {} ({})", absence.getId(), absence.getAbsenceType());
            issues.add(ComplianceIssue.error(ComplianceRule.ABSENCE_CONFLICT,
                    String.format("L'auxiliaire est absent(e) du %s au %s (%s).",
                            ComplianceMessages.day(absence.getStartDate()),
                            ComplianceMessages.day(absence.getEndDate()),
                            absence.getAbsenceType()),
                    absence.getId()));
        }
        return issues;
    }
}
