package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.util.List;

public record ComplianceSummaryDTO(
        double remainingDailyHours,
        double remainingWeeklyHours,
        WeeklyRestStatus weeklyRestStatus,
        List<String> recommendations
) {
}
