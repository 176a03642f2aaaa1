package sp.sistemaspalacios.api_homecare.service.compliance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.AlternativeSlotDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceResult;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceSummaryDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.QuickValidationDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyRestStatus;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.boundaries.nightHours.NightHoursService;
import sp.sistemaspalacios.api_homecare.service.common.TimeService;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService.Interval;
import sp.sistemaspalacios.api_homecare.service.compliance.rules.DailyRestRule;
import sp.sistemaspalacios.api_homecare.service.compliance.rules.RuleContext;
import sp.sistemaspalacios.api_homecare.service.compliance.rules.ShiftRule;
import sp.sistemaspalacios.api_homecare.service.compliance.rules.WeeklyRestRule;
import sp.sistemaspalacios.api_homecare.service.shift.EffectiveHoursService;
import sp.sistemaspalacios.api_homecare.service.shift.RequalificationService;
import sp.sistemaspalacios.api_homecare.service.shift.ShiftDurationService;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;
import sp.sistemaspalacios.api_homecare.validator.shift.ShiftInputValidator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Orquesta las reglas laborales sobre un turno candidato y arma el resultado completo:
 * errores, avisos, reglas no evaluadas, métricas del turno y, con tarifa, la paga.
 *
 * <p>No modifica ninguna entrada. Solo lanza por entradas mal formadas.</p>
 */
@Slf4j
@Service
public class ComplianceCheckerService {

    private static final Set<ComplianceRule> BLOCKING_RULES = EnumSet.of(
            ComplianceRule.SHIFT_OVERLAP,
            ComplianceRule.DAILY_REST,
            ComplianceRule.DAILY_MAX_HOURS,
            ComplianceRule.WEEKLY_MAX_HOURS);

    private static final int MAX_SUGGESTIONS = 3;

    private final List<ShiftRule> rules;
    private final LaborAgreement agreement;
    private final TimeService timeService;
    private final WorkingTimeCalculatorService workingTimeCalculator;
    private final ShiftDurationService shiftDurationService;
    private final NightHoursService nightHoursService;
    private final RequalificationService requalificationService;
    private final EffectiveHoursService effectiveHoursService;
    private final WeeklyHoursService weeklyHoursService;
    private final PayCalculationService payCalculationService;
    private final DailyRestRule dailyRestRule;
    private final WeeklyRestRule weeklyRestRule;

    public ComplianceCheckerService(List<ShiftRule> rules,
                                    LaborAgreement agreement,
                                    TimeService timeService,
                                    WorkingTimeCalculatorService workingTimeCalculator,
                                    ShiftDurationService shiftDurationService,
                                    NightHoursService nightHoursService,
                                    RequalificationService requalificationService,
                                    EffectiveHoursService effectiveHoursService,
                                    WeeklyHoursService weeklyHoursService,
                                    PayCalculationService payCalculationService,
                                    DailyRestRule dailyRestRule,
                                    WeeklyRestRule weeklyRestRule) {
        List<ShiftRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ShiftRule::order));
        this.rules = List.copyOf(sorted);
        this.agreement = agreement;
        this.timeService = timeService;
        this.workingTimeCalculator = workingTimeCalculator;
        this.shiftDurationService = shiftDurationService;
        this.nightHoursService = nightHoursService;
        this.requalificationService = requalificationService;
        this.effectiveHoursService = effectiveHoursService;
        this.weeklyHoursService = weeklyHoursService;
        this.payCalculationService = payCalculationService;
        this.dailyRestRule = dailyRestRule;
        this.weeklyRestRule = weeklyRestRule;
    }

    public ComplianceResult validateShift(Shift candidate, List<? extends Shift> siblings) {
        return validateShift(candidate, siblings, List.of(), null);
    }

    public ComplianceResult validateShift(Shift candidate, List<? extends Shift> siblings, List<AbsenceDTO> absences) {
        return validateShift(candidate, siblings, absences, null);
    }

    public ComplianceResult validateShift(Shift candidate,
                                          List<? extends Shift> siblings,
                                          List<AbsenceDTO> absences,
                                          ContractDTO contract) {
        // ==========================================
        // PASO 1: ENTRADAS (NUNCA ADIVINAR)
        // ==========================================

        ShiftInputValidator.validateShift(candidate);
        ShiftInputValidator.validateShifts(siblings);
        ShiftInputValidator.validateAbsences(absences);

        RuleContext context = buildContext(candidate, siblings, absences, contract);

        // ==========================================
        // PASO 2: REGLAS EN ORDEN
        // ==========================================

        List<ComplianceIssue> errors = new ArrayList<>();
        List<ComplianceIssue> warnings = new ArrayList<>();
        for (ShiftRule rule : rules) {
            for (ComplianceIssue issue : rule.evaluate(context)) {
                (issue.isError() ? errors : warnings).add(issue);
            }
        }

        // ==========================================
        // PASO 3: MÉTRICAS Y PAGA
        // ==========================================

        boolean requalified = requalificationService.isRequalified(candidate);
        ComplianceResult result = ComplianceResult.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .notEvaluated(new ArrayList<>(context.getNotEvaluated()))
                .durationHours(ShiftDurationService.minutesToHours(shiftDurationService.netMinutes(candidate)))
                .nightHours(ShiftDurationService.minutesToHours(
                        nightHoursService.calculateNightMinutes(candidate.date(), candidate.startTime(), candidate.endTime())))
                .requalified(requalified)
                .effectiveHours(effectiveHoursService.computeEffectiveHours(candidate, requalified).orElse(null))
                .build();

        if (contract != null && contract.getHourlyRate() != null) {
            result.setComputedPay(payCalculationService.calculateShiftPay(candidate, contract, context.siblingShifts()));
        }

        if (!result.isValid()) {
            log.debug("⚠️ Turno {} de {}: {} errores, {} avisos",
                    candidate.id(), candidate.employeeId(), errors.size(), warnings.size());
        }
        return result;
    }

    /** Solo los errores que impiden crear el turno. */
    public QuickValidationDTO quickValidate(Shift candidate, List<? extends Shift> siblings) {
        ComplianceResult result = validateShift(candidate, siblings);
        List<String> blocking = result.getErrors().stream()
                .filter(e -> BLOCKING_RULES.contains(e.code()))
                .map(ComplianceIssue::message)
                .toList();
        return new QuickValidationDTO(blocking.isEmpty(), blocking);
    }

    /**
     * Hasta tres huecos alternativos con la misma duración bruta: tras el descanso
     * mínimo desde el turno anterior, o justo al terminar cada turno en conflicto.
     */
    public List<AlternativeSlotDTO> suggestAlternatives(Shift candidate,
                                                        List<? extends Shift> siblings,
                                                        ComplianceResult result) {
        ShiftInputValidator.validateShift(candidate);
        RuleContext context = buildContext(candidate, siblings, List.of(), null);
        int rawMinutes = shiftDurationService.rawMinutes(candidate);

        Set<AlternativeSlotDTO> suggestions = new LinkedHashSet<>();
        for (ComplianceIssue error : result.getErrors()) {
            if (error.code() == ComplianceRule.DAILY_REST) {
                dailyRestRule.findPrevious(context).ifPresent(previous -> suggestions.add(slot(
                        previous.interval().end().plusMinutes(Math.round(agreement.getDailyRestMinHours() * 60)),
                        rawMinutes,
                        "Respecte le repos quotidien de " + ComplianceMessages.hours(agreement.getDailyRestMinHours()))));
            }
            if (error.code() == ComplianceRule.SHIFT_OVERLAP) {
                context.getSiblings().stream()
                        .filter(s -> Objects.equals(s.shift().id(), error.referenceId()))
                        .findFirst()
                        .ifPresent(conflict -> suggestions.add(slot(
                                conflict.interval().end(),
                                rawMinutes,
                                "Après l'intervention de " + conflict.shift().startTime() + "-" + conflict.shift().endTime())));
            }
        }
        return suggestions.stream().limit(MAX_SUGGESTIONS).toList();
    }

    public ComplianceSummaryDTO getComplianceSummary(String employeeId, LocalDate date, List<? extends Shift> shifts) {
        ShiftInputValidator.validateShifts(shifts);
        List<? extends Shift> own = shifts.stream().filter(s -> Objects.equals(s.employeeId(), employeeId)).toList();

        double remainingDaily = Math.max(0, agreement.getDailyMaxHours() - weeklyHoursService.dayHours(employeeId, date, own));
        double remainingWeekly = Math.max(0, agreement.getWeeklyHoursCritical() - weeklyHoursService.weekHours(employeeId, date, own));
        WeeklyRestStatus restStatus = weeklyRestStatus(date, own);

        List<String> recommendations = new ArrayList<>();
        if (remainingDaily <= 2) {
            recommendations.add("Attention : seulement " + ComplianceMessages.hours(remainingDaily) + " disponibles ce jour.");
        }
        if (remainingWeekly <= 8) {
            recommendations.add("Attention : seulement " + ComplianceMessages.hours(remainingWeekly) + " disponibles cette semaine.");
        }
        if (!restStatus.compliant()) {
            recommendations.add("Repos hebdomadaire insuffisant : " + ComplianceMessages.hours(restStatus.longestRestHours())
                    + " (minimum " + ComplianceMessages.hours(agreement.getWeeklyRestMinHours()) + ").");
        }
        return new ComplianceSummaryDTO(remainingDaily, remainingWeekly, restStatus, recommendations);
    }

    public WeeklyRestStatus weeklyRestStatus(LocalDate anyDayOfWeek, List<? extends Shift> employeeShifts) {
        List<Interval> intervals = employeeShifts.stream().map(workingTimeCalculator::anchor).toList();
        return weeklyRestRule.restStatus(anyDayOfWeek, intervals);
    }

    private RuleContext buildContext(Shift candidate, List<? extends Shift> siblings,
                                     List<AbsenceDTO> absences, ContractDTO contract) {
        List<RuleContext.AnchoredShift> anchored = (siblings == null ? List.<Shift>of() : siblings).stream()
                .filter(s -> s != candidate)
                .filter(s -> Objects.equals(s.employeeId(), candidate.employeeId()))
                .filter(s -> candidate.id() == null || !candidate.id().equals(s.id()))
                .map(s -> new RuleContext.AnchoredShift(s, workingTimeCalculator.anchor(s)))
                .toList();
        return new RuleContext(
                new RuleContext.AnchoredShift(candidate, workingTimeCalculator.anchor(candidate)),
                anchored, absences, contract);
    }

    private AlternativeSlotDTO slot(LocalDateTime start, int rawMinutes, String reason) {
        LocalDateTime end = start.plusMinutes(rawMinutes);
        return new AlternativeSlotDTO(start.toLocalDate(),
                timeService.format(start.toLocalTime()),
                timeService.format(end.toLocalTime()),
                reason);
    }
}
