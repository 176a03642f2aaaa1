package sp.sistemaspalacios.api_homecare.controller.compliance;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ComplianceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static final String OVERLAPPING_REQUEST = """
            {
              "candidate": {
                "shiftType": "effective", "id": "c1", "employeeId": "alice",
                "date": "2026-03-03", "startTime": "12:30", "endTime": "17:00", "breakDuration": 0
              },
              "siblings": [
                {
                  "shiftType": "effective", "id": "s1", "employeeId": "alice",
                  "date": "2026-03-03", "startTime": "09:00", "endTime": "13:00", "breakDuration": 0
                }
              ]
            }
            """;

    @Test
    void validate_overlappingShift_returnsErrorReferencingTheExistingShift() throws Exception {
        mockMvc.perform(post("/api/compliance/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERLAPPING_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.errors", hasSize(1)))
            .andExpect(jsonPath("$.errors[0].code").value("SHIFT_OVERLAP"))
            .andExpect(jsonPath("$.errors[0].severity").value("error"))
            .andExpect(jsonPath("$.errors[0].referenceId").value("s1"))
            .andExpect(jsonPath("$.durationHours").value(4.5));
    }

    @Test
    void validate_withoutContractHours_reportsTheSkippedCheck() throws Exception {
        String payload = """
            {
              "candidate": {
                "shiftType": "presence_night", "id": "n1", "employeeId": "alice",
                "date": "2026-03-03", "startTime": "23:00", "endTime": "07:00",
                "nightInterventionsCount": 4
              },
              "contract": { "id": "ctr-1", "employeeId": "alice", "status": "active" }
            }
            """;

        mockMvc.perform(post("/api/compliance/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.requalified").value(true))
            .andExpect(jsonPath("$.nightHours").value(7.0))
            .andExpect(jsonPath("$.notEvaluated[0].code").value("CONTRACT_HOURS_EXCEEDED"));
    }

    @Test
    void validate_invalidTime_returnsBadRequest() throws Exception {
        String payload = """
            {
              "candidate": {
                "shiftType": "effective", "id": "c1", "employeeId": "alice",
                "date": "2026-03-03", "startTime": "25:00", "endTime": "17:00"
              }
            }
            """;

        mockMvc.perform(post("/api/compliance/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_TIME_FORMAT"))
            .andExpect(jsonPath("$.details.startTime").exists());
    }

    @Test
    void validate_missingCandidate_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/compliance/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{ \"siblings\": [] }"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.candidate").exists());
    }

    @Test
    void validate_unknownShiftType_returnsBadRequest() throws Exception {
        String payload = """
            {
              "candidate": {
                "shiftType": "nap", "id": "c1", "employeeId": "alice",
                "date": "2026-03-03", "startTime": "09:00", "endTime": "10:00"
              }
            }
            """;

        mockMvc.perform(post("/api/compliance/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest());
    }

    @Test
    void quickValidate_overlappingShift_cannotBeCreated() throws Exception {
        mockMvc.perform(post("/api/compliance/quick-validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERLAPPING_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.canCreate").value(false))
            .andExpect(jsonPath("$.blockingErrors", hasSize(1)));
    }

    @Test
    void suggestions_withoutPreviousResult_recomputesIt() throws Exception {
        mockMvc.perform(post("/api/compliance/suggestions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERLAPPING_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].date").value("2026-03-03"))
            .andExpect(jsonPath("$[0].startTime").value("13:00"))
            .andExpect(jsonPath("$[0].endTime").value("17:30"));
    }

    @Test
    void summary_reportsRemainingHours() throws Exception {
        String payload = """
            {
              "employeeId": "alice",
              "date": "2026-03-03",
              "shifts": [
                {
                  "shiftType": "effective", "id": "s1", "employeeId": "alice",
                  "date": "2026-03-03", "startTime": "08:30", "endTime": "17:00", "breakDuration": 30
                }
              ]
            }
            """;

        mockMvc.perform(post("/api/compliance/summary")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.remainingDailyHours").value(2.0))
            .andExpect(jsonPath("$.remainingWeeklyHours").value(40.0))
            .andExpect(jsonPath("$.weeklyRestStatus.compliant").value(true))
            .andExpect(jsonPath("$.recommendations", hasSize(1)));
    }

    private static final String OVERVIEW_REQUEST = """
            {
              "employerId": "employer-1",
              "referenceDate": "2026-03-04",
              "contracts": [
                { "id": "ctr-eve", "employeeId": "eve", "employerId": "employer-1",
                  "employeeName": "Eve", "weeklyHours": 35, "status": "active" },
                { "id": "ctr-dan", "employeeId": "dan", "employerId": "employer-1",
                  "employeeName": "Dan", "weeklyHours": 35, "status": "active" }
              ],
              "shifts": [
                { "shiftType": "effective", "id": "e1", "employeeId": "eve",
                  "date": "2026-03-04", "startTime": "08:30", "endTime": "17:00", "breakDuration": 30 },
                { "shiftType": "effective", "id": "d1", "employeeId": "dan",
                  "date": "2026-03-03", "startTime": "09:00", "endTime": "13:00" },
                { "shiftType": "effective", "id": "d2", "employeeId": "dan",
                  "date": "2026-03-03", "startTime": "12:00", "endTime": "15:00" }
              ],
              "weeksBack": 2
            }
            """;

    @Test
    void weeklyOverview_sortsCriticalFirst() throws Exception {
        mockMvc.perform(post("/api/compliance/weekly-overview")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERVIEW_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.weekStart").value("2026-03-02"))
            .andExpect(jsonPath("$.weekLabel").value("Semaine du 2 mars au 8 mars 2026"))
            .andExpect(jsonPath("$.summary.totalEmployees").value(2))
            .andExpect(jsonPath("$.summary.critical").value(1))
            .andExpect(jsonPath("$.summary.warnings").value(1))
            .andExpect(jsonPath("$.employees[0].employeeName").value("Dan"))
            .andExpect(jsonPath("$.employees[0].status").value("critical"))
            .andExpect(jsonPath("$.employees[0].alerts[0].type").value("SHIFT_OVERLAP"))
            .andExpect(jsonPath("$.employees[1].status").value("warning"));
    }

    @Test
    void weeklyOverview_missingReferenceDate_returnsValidationError() throws Exception {
        mockMvc.perform(post("/api/compliance/weekly-overview")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{ \"employerId\": \"employer-1\" }"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.referenceDate").exists());
    }

    @Test
    void history_returnsOneEntryPerWeek() throws Exception {
        mockMvc.perform(post("/api/compliance/history")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERVIEW_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].weekStart").value("2026-02-23"))
            .andExpect(jsonPath("$[0].compliant").value(2))
            .andExpect(jsonPath("$[1].critical").value(1));
    }

    @Test
    void criticalAlerts_arePrefixedWithTheEmployeeName() throws Exception {
        mockMvc.perform(post("/api/compliance/critical-alerts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(OVERVIEW_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0]").value(startsWith("Dan : ")));
    }
}
