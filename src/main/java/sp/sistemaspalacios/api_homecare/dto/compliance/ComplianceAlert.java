package sp.sistemaspalacios.api_homecare.dto.compliance;

import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceLevel;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;

public record ComplianceAlert(ComplianceRule type, ComplianceLevel severity, String message) {
}
