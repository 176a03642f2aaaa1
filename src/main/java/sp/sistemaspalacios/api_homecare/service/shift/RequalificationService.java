package sp.sistemaspalacios.api_homecare.service.shift;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.shift.PresenceNightShift;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.shift.ShiftType;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

/**
 * Presencia nocturna recalificada como trabajo efectivo cuando el número de
 * intervenciones alcanza el umbral del convenio (Art. 148 IDCC 3239).
 */
@Service
@RequiredArgsConstructor
public class RequalificationService {

    private final LaborAgreement agreement;

    public boolean isRequalified(ShiftType shiftType, int nightInterventionsCount) {
        if (nightInterventionsCount < 0) {
            throw new InvalidInputException("nightInterventionsCount",
                    "Le nombre d'interventions de nuit ne peut pas être négatif : " + nightInterventionsCount);
        }
        return shiftType == ShiftType.PRESENCE_NIGHT
                && nightInterventionsCount >= agreement.getRequalificationThreshold();
    }

    public boolean isRequalified(Shift shift) {
        if (shift instanceof PresenceNightShift night) {
            return isRequalified(ShiftType.PRESENCE_NIGHT, night.nightInterventionsCount());
        }
        return false;
    }
}
