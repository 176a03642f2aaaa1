package sp.sistemaspalacios.api_homecare.dto.compliance;

import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;

/** Regla omitida por falta de datos (p.ej. contrato sin horas semanales). */
public record NotEvaluatedCheck(ComplianceRule code, String reason) {
}
