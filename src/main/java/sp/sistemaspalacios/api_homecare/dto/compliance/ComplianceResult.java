package sp.sistemaspalacios.api_homecare.dto.compliance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceResult {

    private boolean valid;

    @Builder.Default
    private List<ComplianceIssue> errors = new ArrayList<>();

    @Builder.Default
    private List<ComplianceIssue> warnings = new ArrayList<>();

    @Builder.Default
    private List<NotEvaluatedCheck> notEvaluated = new ArrayList<>();

    private BigDecimal durationHours;
    private BigDecimal nightHours;
    private BigDecimal effectiveHours;   // null = sin conversión aplicable
    private boolean requalified;
    private ComputedPay computedPay;
}
