package sp.sistemaspalacios.api_homecare.controller.shift;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_homecare.dto.compliance.ShiftMetricsDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.service.boundaries.nightHours.NightHoursService;
import sp.sistemaspalacios.api_homecare.service.shift.EffectiveHoursService;
import sp.sistemaspalacios.api_homecare.service.shift.RequalificationService;
import sp.sistemaspalacios.api_homecare.service.shift.ShiftDurationService;
import sp.sistemaspalacios.api_homecare.validator.shift.ShiftInputValidator;

@RestController
@RequestMapping("/api/shift-metrics")
@RequiredArgsConstructor
public class ShiftMetricsController {

    private final ShiftDurationService shiftDurationService;
    private final NightHoursService nightHoursService;
    private final RequalificationService requalificationService;
    private final EffectiveHoursService effectiveHoursService;

    /**
     * Duración, horas nocturnas, recalificación y horas efectivas de un turno
     * POST /api/shift-metrics
     */
    @PostMapping
    public ResponseEntity<ShiftMetricsDTO> metrics(@RequestBody Shift shift) {
        ShiftInputValidator.validateShift(shift);

        int minutes = shiftDurationService.netMinutes(shift);
        boolean requalified = requalificationService.isRequalified(shift);

        return ResponseEntity.ok(ShiftMetricsDTO.builder()
                .shiftType(shift.shiftType())
                .durationMinutes(minutes)
                .durationHours(ShiftDurationService.minutesToHours(minutes))
                .nightHours(ShiftDurationService.minutesToHours(
                        nightHoursService.calculateNightMinutes(shift.date(), shift.startTime(), shift.endTime())))
                .requalified(requalified)
                .effectiveHours(effectiveHoursService.computeEffectiveHours(shift, requalified).orElse(null))
                .build());
    }
}
