package sp.sistemaspalacios.api_homecare.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceResult;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShiftValidationRequest {

    @NotNull(message = "L'intervention à valider est obligatoire")
    private Shift candidate;

    @Builder.Default
    private List<Shift> siblings = new ArrayList<>();

    @Builder.Default
    private List<AbsenceDTO> absences = new ArrayList<>();

    private ContractDTO contract;

    // Solo para /suggestions: resultado previo de /validate
    private ComplianceResult result;
}
