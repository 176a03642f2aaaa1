package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.math.BigDecimal;

/** Desglose de la remuneración de un turno, en euros con 2 decimales. */
public record ComputedPay(
        BigDecimal basePay,
        BigDecimal sundayMajoration,
        BigDecimal holidayMajoration,
        BigDecimal nightMajoration,
        BigDecimal overtimeMajoration,
        BigDecimal presenceResponsiblePay,
        BigDecimal nightPresenceAllowance,
        BigDecimal totalPay
) {
}
