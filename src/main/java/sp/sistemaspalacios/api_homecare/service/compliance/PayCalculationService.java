package sp.sistemaspalacios.api_homecare.service.compliance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComputedPay;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Guard24hShift;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.service.boundaries.holiday.PublicHolidayService;
import sp.sistemaspalacios.api_homecare.service.boundaries.nightHours.NightHoursService;
import sp.sistemaspalacios.api_homecare.service.shift.EffectiveHoursService;
import sp.sistemaspalacios.api_homecare.service.shift.RequalificationService;
import sp.sistemaspalacios.api_homecare.service.shift.ShiftDurationService;
import sp.sistemaspalacios.api_homecare.service.shift.WeeklyHoursService;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Remuneración de un turno con recargos (IDCC 3239).
 *
 * <p>Recargo nocturno solo si hubo un acto durante la noche: la simple presencia
 * no lo genera. Las horas extra son las que este turno añade por encima de las
 * horas contractuales de su semana.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayCalculationService {

    private final LaborAgreement agreement;
    private final ShiftDurationService shiftDurationService;
    private final NightHoursService nightHoursService;
    private final RequalificationService requalificationService;
    private final EffectiveHoursService effectiveHoursService;
    private final WeeklyHoursService weeklyHoursService;
    private final PublicHolidayService publicHolidayService;

    public ComputedPay calculateShiftPay(Shift shift, ContractDTO contract, List<? extends Shift> siblings) {
        double rate = contract.getHourlyRate().doubleValue();
        double durationHours = shiftDurationService.netHours(shift);

        double basePay = durationHours * rate;
        double presenceResponsiblePay = 0;
        double nightPresenceAllowance = 0;

        switch (shift.shiftType()) {
            case PRESENCE_DAY -> presenceResponsiblePay = durationHours * agreement.getPresenceDayWeight() * rate;
            case PRESENCE_NIGHT -> nightPresenceAllowance = requalificationService.isRequalified(shift)
                    ? durationHours * rate
                    : durationHours * rate * agreement.getNightPresenceAllowanceFraction();
            case GUARD_24H -> {
                Guard24hShift guard = (Guard24hShift) shift;
                if (guard.guardSegments().isEmpty()) {
                    basePay = 0;
                } else {
                    EffectiveHoursService.GuardBreakdown breakdown = effectiveHoursService.guardBreakdown(guard);
                    basePay = breakdown.effectiveMinutes() / 60.0 * rate;
                    nightPresenceAllowance = breakdown.presenceMinutes() / 60.0 * rate
                            * agreement.getNightPresenceAllowanceFraction();
                }
            }
            case EFFECTIVE -> {
                // paga bruta
            }
        }

        double sundayMajoration = publicHolidayService.isSunday(shift.date()) ? basePay * agreement.getSundayRate() : 0;
        double holidayMajoration = 0;
        if (publicHolidayService.isPublicHoliday(shift.date())) {
            holidayMajoration = basePay * (contract.isHabitualHolidayWork()
                    ? agreement.getHolidayHabitualRate()
                    : agreement.getHolidayExceptionalRate());
        }

        double nightMajoration = 0;
        if (shift.hasNightAction()) {
            nightMajoration = nightHoursService.calculateNightHours(shift) * rate * agreement.getNightMajorationRate();
        }

        double overtimeMajoration = 0;
        if (contract.getWeeklyHours() != null) {
            // Los tramos se cuentan sobre la semana: las primeras 8h extra de la semana van al 25%
            double overtime = overtimeHours(shift, siblings, contract.getWeeklyHours());
            double alreadyOvertime = Math.max(0,
                    weeklyHoursService.weekHours(shift.employeeId(), shift.date(), others(shift, siblings))
                            - contract.getWeeklyHours());
            double firstTierLeft = Math.max(0, agreement.getOvertimeFirstTierHours() - alreadyOvertime);
            double firstTier = Math.min(firstTierLeft, overtime);
            double beyond = overtime - firstTier;
            overtimeMajoration = firstTier * rate * agreement.getOvertimeFirstTierRate()
                    + beyond * rate * agreement.getOvertimeBeyondRate();
        }

        double totalPay = switch (shift.shiftType()) {
            case EFFECTIVE -> basePay + sundayMajoration + holidayMajoration + nightMajoration + overtimeMajoration;
            case PRESENCE_DAY -> presenceResponsiblePay + sundayMajoration + holidayMajoration;
            case PRESENCE_NIGHT -> nightPresenceAllowance + nightMajoration;
            case GUARD_24H -> basePay + nightPresenceAllowance + nightMajoration;
        };

        log.debug("💶 Paga turno {}: total {}", shift.id(), totalPay);
        return new ComputedPay(
                money(basePay),
                money(sundayMajoration),
                money(holidayMajoration),
                money(nightMajoration),
                money(overtimeMajoration),
                money(presenceResponsiblePay),
                money(nightPresenceAllowance),
                money(totalPay));
    }

    /** Horas extra generadas por este turno dentro de su semana ISO. */
    public double overtimeHours(Shift shift, List<? extends Shift> siblings, double contractualWeeklyHours) {
        double previous = weeklyHoursService.weekHours(shift.employeeId(), shift.date(), others(shift, siblings));
        double total = previous + shiftDurationService.netHours(shift);

        double previousOvertime = Math.max(0, previous - contractualWeeklyHours);
        double totalOvertime = Math.max(0, total - contractualWeeklyHours);
        return totalOvertime - previousOvertime;
    }

    private static List<Shift> others(Shift shift, List<? extends Shift> siblings) {
        return siblings.stream()
                .filter(s -> s != shift)
                .filter(s -> shift.id() == null || !shift.id().equals(s.id()))
                .filter(s -> Objects.equals(s.employeeId(), shift.employeeId()))
                .map(s -> (Shift) s)
                .toList();
    }

    private static BigDecimal money(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP);
    }
}
