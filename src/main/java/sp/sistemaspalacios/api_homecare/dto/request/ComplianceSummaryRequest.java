package sp.sistemaspalacios.api_homecare.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceSummaryRequest {

    @NotBlank(message = "L'auxiliaire est obligatoire")
    private String employeeId;

    @NotNull(message = "La date est obligatoire")
    private LocalDate date;

    @Builder.Default
    private List<Shift> shifts = new ArrayList<>();
}
