package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.time.LocalDate;

public record WeeklyHistoryEntryDTO(LocalDate weekStart, String weekLabel, int compliant, int warnings, int critical) {
}
