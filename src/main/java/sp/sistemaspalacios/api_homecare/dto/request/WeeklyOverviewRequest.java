package sp.sistemaspalacios.api_homecare.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyOverviewRequest {

    private String employerId;

    @NotNull(message = "La date de référence est obligatoire")
    private LocalDate referenceDate;

    @Builder.Default
    private List<ContractDTO> contracts = new ArrayList<>();

    @Builder.Default
    private List<Shift> shifts = new ArrayList<>();

    @Builder.Default
    private List<AbsenceDTO> absences = new ArrayList<>();

    // Solo para /history
    @Min(value = 1, message = "Au moins une semaine")
    @Builder.Default
    private int weeksBack = 4;
}
