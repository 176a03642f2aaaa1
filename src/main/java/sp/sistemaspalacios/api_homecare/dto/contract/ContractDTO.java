package sp.sistemaspalacios.api_homecare.dto.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContractDTO {
    private String id;
    private String employeeId;
    private String employerId;
    private String employeeName;
    private Double weeklyHours;      // techo contractual; null = no se evalúa
    private BigDecimal hourlyRate;   // null = no se calcula la paga
    private String status;           // "active", "terminated", ...
    private boolean habitualHolidayWork;  // trabajo habitual en festivos: +60% en vez de +100%

    @JsonIgnore
    public boolean isActive() {
        return status == null || "active".equalsIgnoreCase(status);
    }
}
