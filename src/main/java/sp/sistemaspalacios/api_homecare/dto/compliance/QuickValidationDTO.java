package sp.sistemaspalacios.api_homecare.dto.compliance;

import java.util.List;

public record QuickValidationDTO(boolean canCreate, List<String> blockingErrors) {
}
