package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.time.LocalDateTime;
import java.util.List;

public record WeeklyRestStatus(double longestRestHours, boolean compliant, List<RestPeriod> restPeriods) {

    public record RestPeriod(LocalDateTime start, LocalDateTime end, double hours) {
    }
}
