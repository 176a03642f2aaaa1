package sp.sistemaspalacios.api_homecare.dto.compliance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.entity.compliance.Severity;

/**
 * Un error o aviso de conformidad. {@code referenceId} apunta al turno o ausencia
 * en conflicto cuando la regla lo tiene.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceIssue(
        ComplianceRule code,
        Severity severity,
        String message,
        String rule,
        String referenceId
) {

    public static ComplianceIssue error(ComplianceRule code, String message) {
        return new ComplianceIssue(code, Severity.ERROR, message, code.getLegalReference(), null);
    }

    public static ComplianceIssue error(ComplianceRule code, String message, String referenceId) {
        return new ComplianceIssue(code, Severity.ERROR, message, code.getLegalReference(), referenceId);
    }

    public static ComplianceIssue warning(ComplianceRule code, String message) {
        return new ComplianceIssue(code, Severity.WARNING, message, code.getLegalReference(), null);
    }

    public static ComplianceIssue warning(ComplianceRule code, String message, String referenceId) {
        return new ComplianceIssue(code, Severity.WARNING, message, code.getLegalReference(), referenceId);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
