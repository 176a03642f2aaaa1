package sp.sistemaspalacios.api_homecare.service.compliance;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_homecare.ComplianceTestFixtures;
import sp.sistemaspalacios.api_homecare.dto.compliance.ComplianceAlert;
import sp.sistemaspalacios.api_homecare.dto.compliance.EmployeeComplianceStatus;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyComplianceOverview;
import sp.sistemaspalacios.api_homecare.dto.compliance.WeeklyHistoryEntryDTO;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceLevel;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.MONDAY;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.contract;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.effective;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.effectiveSegment;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.guard;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.presenceSegment;

class WeeklyComplianceOverviewServiceTest {

    private static final String EMPLOYER = "employer-1";
    private static final LocalDate SUNDAY = MONDAY.plusDays(6);

    private final WeeklyComplianceOverviewService service = ComplianceTestFixtures.engine().overview();

    /** Lunes a jueves 10h netas (07:40-18:00 con 20 min de pausa) y un viernes a medida. */
    private static List<Shift> longWeek(String employeeId, String fridayEnd, int fridayBreak) {
        List<Shift> shifts = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            shifts.add(effective(employeeId + "-" + i, employeeId, MONDAY.plusDays(i), "07:40", "18:00", 20));
        }
        shifts.add(effective(employeeId + "-fri", employeeId, MONDAY.plusDays(4), "08:00", fridayEnd, fridayBreak));
        return shifts;
    }

    private static List<Shift> team() {
        List<Shift> shifts = new ArrayList<>();
        shifts.addAll(longWeek("alice", "14:00", 0));     // 46h
        shifts.addAll(longWeek("bruno", "16:20", 20));    // 48h
        shifts.add(effective("chloe-1", "chloe", MONDAY.plusDays(1), "09:00", "12:00", 0));
        shifts.add(effective("chloe-2", "chloe", MONDAY.plusDays(3), "09:00", "12:00", 0));
        return shifts;
    }

    private static List<ContractDTO> contracts() {
        ContractDTO terminated = contract("dora", "Dora", 35.0, null).toBuilder().status("terminated").build();
        ContractDTO otherEmployer = contract("eric", "Eric", 35.0, null).toBuilder().employerId("employer-2").build();
        return List.of(
                contract("chloe", "Chloé", 20.0, null),
                contract("alice", "Alice", 35.0, "12.00"),
                contract("bruno", "Bruno", 39.0, null),
                terminated,
                otherEmployer);
    }

    @Test
    void employeesAreSortedByStatusThenName() {
        WeeklyComplianceOverview overview = service.getWeeklyOverview(EMPLOYER, contracts(), team(), List.of(), SUNDAY);

        assertThat(overview.getEmployees())
                .extracting(EmployeeComplianceStatus::getEmployeeName, EmployeeComplianceStatus::getStatus)
                .containsExactly(
                        tuple("Bruno", ComplianceLevel.CRITICAL),
                        tuple("Alice", ComplianceLevel.WARNING),
                        tuple("Chloé", ComplianceLevel.OK));
        assertThat(overview.getSummary()).isEqualTo(new WeeklyComplianceOverview.Summary(3, 1, 1, 1));
        assertThat(overview.getWeekStart()).isEqualTo(MONDAY);
        assertThat(overview.getWeekEnd()).isEqualTo(SUNDAY);
        assertThat(overview.getWeekLabel()).isEqualTo("Semaine du 2 mars au 8 mars 2026");
    }

    @Test
    void fortySixHoursOnAThirtyFiveHourContractIsAWarningNotCritical() {
        EmployeeComplianceStatus alice = find(service.getWeeklyOverview(EMPLOYER, contracts(), team(), List.of(), SUNDAY), "alice");

        assertThat(alice.getStatus()).isEqualTo(ComplianceLevel.WARNING);
        assertThat(alice.getCurrentWeekHours()).isEqualTo(46.0);
        assertThat(alice.getRemainingWeeklyHours()).isEqualTo(2.0);
        assertThat(alice.getRemainingDailyHours()).isEqualTo(10.0);
        // Una alerta por código aunque los cinco turnos la disparen
        assertThat(alice.getAlerts())
                .extracting(ComplianceAlert::type, ComplianceAlert::severity)
                .containsExactly(
                        tuple(ComplianceRule.WEEKLY_MAX_HOURS, ComplianceLevel.WARNING),
                        tuple(ComplianceRule.CONTRACT_HOURS_EXCEEDED, ComplianceLevel.WARNING));
    }

    @Test
    void exactlyFortyEightHoursIsCritical() {
        EmployeeComplianceStatus bruno = find(service.getWeeklyOverview(EMPLOYER, contracts(), team(), List.of(), SUNDAY), "bruno");

        assertThat(bruno.getStatus()).isEqualTo(ComplianceLevel.CRITICAL);
        assertThat(bruno.getRemainingWeeklyHours()).isZero();
        assertThat(bruno.getAlerts())
                .extracting(ComplianceAlert::type)
                .containsExactly(ComplianceRule.WEEKLY_MAX_HOURS, ComplianceRule.CONTRACT_HOURS_EXCEEDED);
    }

    @Test
    void overlapBetweenTwoShiftsIsReportedOnce() {
        List<Shift> shifts = List.of(
                effective("a", "dan", MONDAY.plusDays(1), "09:00", "13:00", 0),
                effective("b", "dan", MONDAY.plusDays(1), "12:00", "15:00", 0));

        EmployeeComplianceStatus dan = service.getWeeklyOverview(EMPLOYER,
                List.of(contract("dan", "Dan", 35.0, null)), shifts, List.of(), SUNDAY).getEmployees().get(0);

        assertThat(dan.getAlerts())
                .extracting(ComplianceAlert::type, ComplianceAlert::severity)
                .containsExactly(tuple(ComplianceRule.SHIFT_OVERLAP, ComplianceLevel.CRITICAL));
    }

    @Test
    void nearlyFullReferenceDayRaisesADailyWarning() {
        LocalDate wednesday = MONDAY.plusDays(2);
        List<Shift> shifts = List.of(effective("e1", "eve", wednesday, "08:30", "17:00", 30));

        EmployeeComplianceStatus eve = service.getWeeklyOverview(EMPLOYER,
                List.of(contract("eve", "Eve", 35.0, null)), shifts, List.of(), wednesday).getEmployees().get(0);

        assertThat(eve.getRemainingDailyHours()).isEqualTo(2.0);
        assertThat(eve.getStatus()).isEqualTo(ComplianceLevel.WARNING);
        assertThat(eve.getAlerts())
                .extracting(ComplianceAlert::type)
                .containsExactly(ComplianceRule.DAILY_MAX_HOURS);
    }

    @Test
    void guardIsNotCriticalForItsPresenceHours() {
        LocalDate tuesday = MONDAY.plusDays(1);
        List<Shift> shifts = List.of(guard("g1", "gus", tuesday, "08:00", "08:00",
                effectiveSegment("08:00", 0), presenceSegment("14:00")));

        EmployeeComplianceStatus gus = service.getWeeklyOverview(EMPLOYER,
                List.of(contract("gus", "Gus", 35.0, null)), shifts, List.of(), tuesday).getEmployees().get(0);

        assertThat(gus.getRemainingDailyHours()).isEqualTo(4.0);
        assertThat(gus.getStatus()).isEqualTo(ComplianceLevel.WARNING);
        assertThat(gus.getAlerts())
                .extracting(ComplianceAlert::type)
                .doesNotContain(ComplianceRule.DAILY_MAX_HOURS);
    }

    @Test
    void shiftsOutsideTheReferenceWeekAreIgnored() {
        List<Shift> nextWeek = longWeek("alice", "16:20", 20).stream()
                .map(s -> (Shift) effective(s.id(), s.employeeId(), s.date().plusWeeks(1), s.startTime(), s.endTime(), s.breakDuration()))
                .toList();

        WeeklyComplianceOverview overview = service.getWeeklyOverview(EMPLOYER,
                List.of(contract("alice", "Alice", 35.0, null)), nextWeek, List.of(), SUNDAY);

        assertThat(overview.getEmployees().get(0).getStatus()).isEqualTo(ComplianceLevel.OK);
        assertThat(overview.getEmployees().get(0).getCurrentWeekHours()).isZero();
    }

    @Test
    void historyListsWeeksFromOldestToReference() {
        List<WeeklyHistoryEntryDTO> history = service.getComplianceHistory(EMPLOYER, contracts(), team(), List.of(), SUNDAY, 3);

        assertThat(history)
                .extracting(WeeklyHistoryEntryDTO::weekStart)
                .containsExactly(MONDAY.minusWeeks(2), MONDAY.minusWeeks(1), MONDAY);
        assertThat(history.get(0).compliant()).isEqualTo(3);
        assertThat(history.get(2))
                .extracting(WeeklyHistoryEntryDTO::compliant, WeeklyHistoryEntryDTO::warnings, WeeklyHistoryEntryDTO::critical)
                .containsExactly(1, 1, 1);
    }

    @Test
    void criticalAlertsArePrefixedWithTheEmployeeName() {
        List<String> alerts = service.getCriticalAlerts(EMPLOYER, contracts(), team(), List.of(), SUNDAY);

        assertThat(alerts).singleElement().satisfies(a -> assertThat(a).startsWith("Bruno : "));
    }

    @Test
    void referenceDateIsMandatory() {
        assertThatThrownBy(() -> service.getWeeklyOverview(EMPLOYER, contracts(), team(), List.of(), null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void historyAlsoRequiresAReferenceDate() {
        assertThatThrownBy(() -> service.getComplianceHistory(EMPLOYER, contracts(), team(), List.of(), null, 3))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void historyNeedsAtLeastOneWeek() {
        assertThatThrownBy(() -> service.getComplianceHistory(EMPLOYER, contracts(), team(), List.of(), SUNDAY, 0))
                .isInstanceOf(InvalidInputException.class);
    }

    private static EmployeeComplianceStatus find(WeeklyComplianceOverview overview, String employeeId) {
        return overview.getEmployees().stream()
                .filter(e -> e.getEmployeeId().equals(employeeId))
                .findFirst()
                .orElseThrow();
    }
}
