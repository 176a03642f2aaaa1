package sp.sistemaspalacios.api_homecare.service.compliance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceAlert;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceResult;
import sp.sistemaspalacios.api_homecare.dto.compliance.EmployeeComplianceStatus;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyComplianceOverview;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyHistoryEntryDTO;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceLevel;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vista semanal de conformidad para un empleador: cada turno de la semana de cada
 * auxiliar activo se revalida contra sus demás turnos y los problemas se convierten
 * en alertas.
 *
 * <p>La semana se fija con {@code referenceDate}; nunca se lee el reloj del sistema.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeeklyComplianceOverviewService {

    // Reglas que miden la semana completa: una sola alerta por código.
    private static final Set<ComplianceRule> WEEK_LEVEL_RULES = EnumSet.of(
            ComplianceRule.WEEKLY_REST,
            ComplianceRule.WEEKLY_MAX_HOURS,
            ComplianceRule.CONTRACT_HOURS_EXCEEDED,
            ComplianceRule.CONSECUTIVE_NIGHTS_MAX,
            ComplianceRule.GUARD_MAX_AMPLITUDE);

    private final LaborAgreement agreement;
    private final ComplianceCheckerService complianceCheckerService;
    private final WeeklyHoursService weeklyHoursService;

    public WeeklyComplianceOverview getWeeklyOverview(String employerId,
                                                      List<ContractDTO> contracts,
                                                      List<? extends Shift> shifts,
                                                      List<AbsenceDTO> absences,
                                                      LocalDate referenceDate) {
        if (referenceDate == null) {
            throw new InvalidInputException("referenceDate", "La date de référence est obligatoire.");
        }
        LocalDate weekStart = weeklyHoursService.weekStart(referenceDate);
        List<? extends Shift> allShifts = shifts == null ? List.of() : shifts;
        List<AbsenceDTO> allAbsences = absences == null ? List.of() : absences;

        List<EmployeeComplianceStatus> employees = (contracts == null ? List.<ContractDTO>of() : contracts).stream()
                .filter(ContractDTO::isActive)
                .filter(c -> employerId == null || Objects.equals(employerId, c.getEmployerId()))
                .map(c -> employeeStatus(c, allShifts, allAbsences, referenceDate))
                .sorted(Comparator.comparing(EmployeeComplianceStatus::getStatus)
                        .thenComparing(EmployeeComplianceStatus::getEmployeeName,
                                Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .toList();

        WeeklyComplianceOverview.Summary summary = new WeeklyComplianceOverview.Summary(
                employees.size(),
                count(employees, ComplianceLevel.OK),
                count(employees, ComplianceLevel.WARNING),
                count(employees, ComplianceLevel.CRITICAL));

        log.info("📋 Conformidad {} ({}): {} auxiliares, {} ok, {} avisos, {} críticos",
                employerId, weekStart, summary.totalEmployees(), summary.compliant(),
                summary.warnings(), summary.critical());

        return WeeklyComplianceOverview.builder()
                .employerId(employerId)
                .weekStart(weekStart)
                .weekEnd(weeklyHoursService.weekEnd(referenceDate))
                .weekLabel(weeklyHoursService.weekLabel(referenceDate))
                .employees(new ArrayList<>(employees))
                .summary(summary)
                .build();
    }

    /** Un resumen por semana, de la más antigua a la de {@code referenceDate}. */
    public List<WeeklyHistoryEntryDTO> getComplianceHistory(String employerId,
                                                            List<ContractDTO> contracts,
                                                            List<? extends Shift> shifts,
                                                            List<AbsenceDTO> absences,
                                                            LocalDate referenceDate,
                                                            int weeksBack) {
        if (referenceDate == null) {
            throw new InvalidInputException("referenceDate", "La date de référence est obligatoire.");
        }
        if (weeksBack < 1) {
            throw new InvalidInputException("weeksBack", "Le nombre de semaines doit être au moins 1 : " + weeksBack);
        }
        List<WeeklyHistoryEntryDTO> history = new ArrayList<>();
        for (int i = weeksBack - 1; i >= 0; i--) {
            WeeklyComplianceOverview week = getWeeklyOverview(employerId, contracts, shifts, absences,
                    referenceDate.minusWeeks(i));
            history.add(new WeeklyHistoryEntryDTO(week.getWeekStart(), week.getWeekLabel(),
                    week.getSummary().compliant(), week.getSummary().warnings(), week.getSummary().critical()));
        }
        return history;
    }

    /** Alertas críticas de la semana, precedidas del nombre del auxiliar. */
    public List<String> getCriticalAlerts(String employerId,
                                          List<ContractDTO> contracts,
                                          List<? extends Shift> shifts,
                                          List<AbsenceDTO> absences,
                                          LocalDate referenceDate) {
        List<String> alerts = new ArrayList<>();
        for (EmployeeComplianceStatus employee : getWeeklyOverview(employerId, contracts, shifts, absences, referenceDate).getEmployees()) {
            employee.getAlerts().stream()
                    .filter(a -> a.severity() == ComplianceLevel.CRITICAL)
                    .forEach(a -> alerts.add(employee.getEmployeeName() + " : " + a.message()));
        }
        return alerts;
    }

    private EmployeeComplianceStatus employeeStatus(ContractDTO contract,
                                                    List<? extends Shift> shifts,
                                                    List<AbsenceDTO> absences,
                                                    LocalDate referenceDate) {
        String employeeId = contract.getEmployeeId();
        List<? extends Shift> employeeShifts = shifts.stream()
                .filter(s -> Objects.equals(s.employeeId(), employeeId))
                .toList();
        List<? extends Shift> weekShifts = employeeShifts.stream()
                .filter(s -> weeklyHoursService.sameWeek(s.date(), referenceDate))
                .toList();

        // La paga no interesa aquí
        ContractDTO withoutPay = contract.toBuilder().hourlyRate(null).build();

        Map<String, ComplianceAlert> alerts = new LinkedHashMap<>();
        for (Shift shift : weekShifts) {
            ComplianceResult result = complianceCheckerService.validateShift(shift, employeeShifts, absences, withoutPay);
            result.getErrors().forEach(issue -> alerts.putIfAbsent(dedupeKey(shift, issue), toAlert(issue)));
            result.getWarnings().forEach(issue -> alerts.putIfAbsent(dedupeKey(shift, issue), toAlert(issue)));
        }

        double currentWeekHours = weeklyHoursService.weekHours(employeeId, referenceDate, weekShifts);
        double remainingWeekly = Math.max(0, agreement.getWeeklyHoursCritical() - currentWeekHours);
        double remainingDaily = Math.max(0,
                agreement.getDailyMaxHours() - weeklyHoursService.dayHours(employeeId, referenceDate, employeeShifts));

        List<ComplianceAlert> alertList = new ArrayList<>(alerts.values());
        if (remainingDaily <= 0) {
            alertList.add(new ComplianceAlert(ComplianceRule.DAILY_MAX_HOURS, ComplianceLevel.CRITICAL,
                    "Maximum quotidien atteint le " + ComplianceMessages.day(referenceDate)));
        } else if (remainingDaily <= 2) {
            alertList.add(new ComplianceAlert(ComplianceRule.DAILY_MAX_HOURS, ComplianceLevel.WARNING,
                    "Seulement " + ComplianceMessages.hours(remainingDaily) + " disponibles le "
                            + ComplianceMessages.day(referenceDate)));
        }

        ComplianceLevel status = alertList.stream()
                .map(ComplianceAlert::severity)
                .min(Comparator.naturalOrder())
                .orElse(ComplianceLevel.OK);

        return EmployeeComplianceStatus.builder()
                .employeeId(employeeId)
                .employeeName(contract.getEmployeeName())
                .contractId(contract.getId())
                .weeklyHours(contract.getWeeklyHours())
                .currentWeekHours(round2(currentWeekHours))
                .remainingWeeklyHours(round2(remainingWeekly))
                .remainingDailyHours(round2(remainingDaily))
                .weeklyRestStatus(complianceCheckerService.weeklyRestStatus(referenceDate, employeeShifts))
                .alerts(alertList)
                .status(status)
                .build();
    }

    /**
     * Clave (código, {turno, referencia} sin orden): el solape A-B y el B-A son la misma alerta.
     * Las reglas semanales colapsan por código y el máximo diario por fecha.
     */
    private static String dedupeKey(Shift shift, ComplianceIssue issue) {
        if (WEEK_LEVEL_RULES.contains(issue.code())) {
            return issue.code().name();
        }
        if (issue.code() == ComplianceRule.DAILY_MAX_HOURS) {
            return issue.code().name() + "|" + shift.date();
        }
        Set<String> ids = new HashSet<>();
        ids.add(String.valueOf(shift.id()));
        if (issue.referenceId() != null) ids.add(issue.referenceId());
        return issue.code().name() + "|" + ids.stream().sorted().toList();
    }

    private static ComplianceAlert toAlert(ComplianceIssue issue) {
        return new ComplianceAlert(issue.code(), ComplianceLevel.fromSeverity(issue.severity()), issue.message());
    }

    private static int count(List<EmployeeComplianceStatus> employees, ComplianceLevel level) {
        return (int) employees.stream().filter(e -> e.getStatus() == level).count();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
