package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceIssue;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyRestStatus;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService.Interval;
import sp.sistemaspalacios.api_homecare.service.compliance.ComplianceMessages;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Descanso semanal: el mayor tramo libre dentro de la semana ISO del candidato
 * (lunes 00:00 a lunes siguiente 00:00). Los turnos se recortan a la semana y se
 * fusionan antes de medir los huecos.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeeklyRestRule implements ShiftRule {

    private final LaborAgreement agreement;
    private final WeeklyHoursService weeklyHoursService;

    @Override
    public int order() {
        return 30;
    }

    @Override
    public List<ComplianceIssue> evaluate(RuleContext context) {
        List<Interval> intervals = context.withCandidate().stream()
                .map(RuleContext.AnchoredShift::interval)
                .toList();
        WeeklyRestStatus status = restStatus(context.candidateShift().date(), intervals);

        if (status.compliant()) return List.of();

        log.debug("🛌 Descanso semanal máximo {}h", status.longestRestHours());
        return List.of(ComplianceIssue.error(ComplianceRule.WEEKLY_REST,
                String.format("Repos hebdomadaire insuffisant : %s au lieu de %s minimum.",
                        ComplianceMessages.hours(status.longestRestHours()),
                        ComplianceMessages.hours(agreement.getWeeklyRestMinHours()))));
    }

    public WeeklyRestStatus restStatus(LocalDate anyDayOfWeek, Collection<Interval> intervals) {
        LocalDateTime weekStart = weeklyHoursService.weekStart(anyDayOfWeek).atStartOfDay();
        LocalDateTime weekEnd = weekStart.plusDays(7);

        List<Interval> busy = merge(intervals.stream()
                .map(i -> i.clip(weekStart, weekEnd))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(Interval::start))
                .toList());

        List<WeeklyRestStatus.RestPeriod> periods = new ArrayList<>();
        LocalDateTime cursor = weekStart;
        for (Interval interval : busy) {
            addPeriod(periods, cursor, interval.start());
            cursor = interval.end();
        }
        addPeriod(periods, cursor, weekEnd);

        double longest = periods.stream().mapToDouble(WeeklyRestStatus.RestPeriod::hours).max().orElse(0);
        return new WeeklyRestStatus(longest, longest >= agreement.getWeeklyRestMinHours(), periods);
    }

    private static void addPeriod(List<WeeklyRestStatus.RestPeriod> periods, LocalDateTime from, LocalDateTime to) {
        if (!to.isAfter(from)) return;
        periods.add(new WeeklyRestStatus.RestPeriod(from, to, Duration.between(from, to).toMinutes() / 60.0));
    }

    private static List<Interval> merge(List<Interval> sorted) {
        List<Interval> merged = new ArrayList<>();
        for (Interval interval : sorted) {
            if (!merged.isEmpty()) {
                Interval last = merged.get(merged.size() - 1);
                if (!interval.start().isAfter(last.end())) {
                    LocalDateTime end = interval.end().isAfter(last.end()) ? interval.end() : last.end();
                    merged.set(merged.size() - 1, new Interval(last.start(), end));
                    continue;
                }
            }
            merged.add(interval);
        }
        return merged;
    }
}
