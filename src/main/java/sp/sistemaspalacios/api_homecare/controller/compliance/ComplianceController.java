package sp.sistemaspalacios.api_homecare.controller.compliance;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_homecare.dto.compliance.AlternativeSlotDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceResult;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceSummaryDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.QuickValidationDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyComplianceOverview;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyHistoryEntryDTO;
import sp.sistemaspalacios.api_homecare.dto.request.ComplianceSummaryRequest;
import sp.sistemaspalacios.api_homecare.dto.request.ShiftValidationRequest;
import sp.sistemaspalacios.api_homecare.dto.request.WeeklyOverviewRequest;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceCheckerService;
import sp.sistemaspalacios.api_homecare.service.compliance.WeeklyComplianceOverviewService;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/compliance")
@RequiredArgsConstructor
public class ComplianceController {

    private final ComplianceCheckerService complianceCheckerService;
    private final WeeklyComplianceOverviewService weeklyComplianceOverviewService;

    /**
     * Valida un turno contra los demás turnos del auxiliar, sus ausencias y su contrato
     * POST /api/compliance/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ComplianceResult> validate(@Valid @RequestBody ShiftValidationRequest request) {
        return ResponseEntity.ok(complianceCheckerService.validateShift(
                request.getCandidate(),
                request.getSiblings(),
                request.getAbsences(),
                request.getContract()));
    }

    /**
     * Solo errores bloqueantes
     * POST /api/compliance/quick-validate
     */
    @PostMapping("/quick-validate")
    public ResponseEntity<QuickValidationDTO> quickValidate(@Valid @RequestBody ShiftValidationRequest request) {
        return ResponseEntity.ok(complianceCheckerService.quickValidate(request.getCandidate(), request.getSiblings()));
    }

    /**
     * Huecos alternativos; si no llega el resultado previo se recalcula
     * POST /api/compliance/suggestions
     */
    @PostMapping("/suggestions")
    public ResponseEntity<List<AlternativeSlotDTO>> suggestions(@Valid @RequestBody ShiftValidationRequest request) {
        ComplianceResult result = request.getResult() != null
                ? request.getResult()
                : complianceCheckerService.validateShift(request.getCandidate(), request.getSiblings(), request.getAbsences());
        return ResponseEntity.ok(complianceCheckerService.suggestAlternatives(
                request.getCandidate(), request.getSiblings(), result));
    }

    /**
     * Horas restantes y descanso semanal de un auxiliar
     * POST /api/compliance/summary
     */
    @PostMapping("/summary")
    public ResponseEntity<ComplianceSummaryDTO> summary(@Valid @RequestBody ComplianceSummaryRequest request) {
        return ResponseEntity.ok(complianceCheckerService.getComplianceSummary(
                request.getEmployeeId(), request.getDate(), request.getShifts()));
    }

    /**
     * Vista semanal de un empleador
     * POST /api/compliance/weekly-overview
     */
    @PostMapping("/weekly-overview")
    public ResponseEntity<WeeklyComplianceOverview> weeklyOverview(@Valid @RequestBody WeeklyOverviewRequest request) {
        log.info("📥 Vista semanal solicitada para {} ({})", request.getEmployerId(), request.getReferenceDate());
        return ResponseEntity.ok(weeklyComplianceOverviewService.getWeeklyOverview(
                request.getEmployerId(),
                request.getContracts(),
                request.getShifts(),
                request.getAbsences(),
                request.getReferenceDate()));
    }

    /**
     * POST /api/compliance/history
     */
    @PostMapping("/history")
    public ResponseEntity<List<WeeklyHistoryEntryDTO>> history(@Valid @RequestBody WeeklyOverviewRequest request) {
        return ResponseEntity.ok(weeklyComplianceOverviewService.getComplianceHistory(
                request.getEmployerId(),
                request.getContracts(),
                request.getShifts(),
                request.getAbsences(),
                request.getReferenceDate(),
                request.getWeeksBack()));
    }

    /**
     * POST /api/compliance/critical-alerts
     */
    @PostMapping("/critical-alerts")
    public ResponseEntity<List<String>> criticalAlerts(@Valid @RequestBody WeeklyOverviewRequest request) {
        return ResponseEntity.ok(weeklyComplianceOverviewService.getCriticalAlerts(
                request.getEmployerId(),
                request.getContracts(),
                request.getShifts(),
                request.getAbsences(),
                request.getReferenceDate()));
    }
}
