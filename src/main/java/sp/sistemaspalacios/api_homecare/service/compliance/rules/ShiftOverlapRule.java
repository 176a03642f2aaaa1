package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;

import java.util.ArrayList;
import java.util.List;

/** Un auxiliar no puede estar en dos intervenciones a la vez; un error por turno en conflicto. */
@Slf4j
@Component
public class ShiftOverlapRule implements ShiftRule {

    @Override
    public int order() {
        return 10;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        List<ComplianceIssue> issues = new ArrayList<>();
        for (RuleContext.AnchoredShift sibling : context.getSiblings()) {
            if (!sibling.interval().overlaps(context.candidateInterval())) continue;

            String description = ComplianceMessages.day(sibling.shift().date()) + " "
                    + sibling.shift().startTime() + "-" + sibling.shift().endTime();
            log.debug("🔁 Solape con turno {} ({})", sibling.shift().id(), description);
            issues.add(ComplianceIssue.error(ComplianceRule.SHIFT_OVERLAP,
                    "Chevauchement avec une intervention existante : " + description,
                    sibling.shift().id()));
        }
        return issues;
    }
}
