package sp.sistemaspalacios.api_homecare.dto.compliance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyComplianceOverview {
    private String employerId;
    private LocalDate weekStart;
    private LocalDate weekEnd;
    private String weekLabel;

    @Builder.Default
    private List<EmployeeComplianceStatus> employees = new ArrayList<>();

    private Summary summary;

    public record Summary(int totalEmployees, int compliant, int warnings, int critical) {
    }
}
