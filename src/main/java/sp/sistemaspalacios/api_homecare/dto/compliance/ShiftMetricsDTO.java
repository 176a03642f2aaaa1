package sp.sistemaspalacios.api_homecare.dto.compliance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;

import java.math.BigDecimal;

/** Métricas de un turno aislado, sin reglas. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShiftMetricsDTO(
        ShiftType shiftType,
        int durationMinutes,
        BigDecimal durationHours,
        BigDecimal nightHours,
        boolean requalified,
        BigDecimal effectiveHours
) {
}
