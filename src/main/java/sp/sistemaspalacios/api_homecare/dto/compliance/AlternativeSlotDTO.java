package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.time.LocalDate;

public record AlternativeSlotDTO(LocalDate date, String startTime, String endTime, String reason) {
}
