package sp.sistemaspalacios.api_homecare.dto.absence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_homecare.entity.absence.AbsenceStatus;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbsenceDTO {
    private String id;
    private String employeeId;
    private String absenceType;   // sick, vacation, training, unavailable, emergency, family_event
    private LocalDate startDate;
    private LocalDate endDate;    // inclusive
    private AbsenceStatus status;

    @JsonIgnore
    public boolean isApproved() {
        return status == AbsenceStatus.APPROVED;
    }
}
