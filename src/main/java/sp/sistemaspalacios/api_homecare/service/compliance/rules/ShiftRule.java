package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;

import java.util.List;

/**
 * Una regla laboral evaluada sobre un turno candidato.
 * Las violaciones se devuelven como issues; nunca se lanzan.
 */
public interface ShiftRule {

    /** Posición en la evaluación; menor primero. */
    int order();

    List<ComplianceIssue> evaluate(RuleContext context);
}
