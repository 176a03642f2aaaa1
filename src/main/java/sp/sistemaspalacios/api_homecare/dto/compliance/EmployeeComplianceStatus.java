package sp.sistemaspalacios.api_homecare.dto.compliance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceLevel;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeComplianceStatus {
    private String employeeId;
    private String employeeName;
    private String contractId;
    private Double weeklyHours;
    private double currentWeekHours;
    private double remainingWeeklyHours;
    private double remainingDailyHours;
    private WeeklyRestStatus weeklyRestStatus;

    @Builder.Default
    private List<ComplianceAlert> alerts = new ArrayList<>();

    private ComplianceLevel status;
}
