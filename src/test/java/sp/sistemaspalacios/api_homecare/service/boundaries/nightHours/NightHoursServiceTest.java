package sp.sistemaspalacios.api_homecare.service.boundaries.nightHours;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import sp.sistemaspalacios.api_homecare.ComplianceTestFixtures;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;
import sp.sistemaspalacios.api_homecare.exception.InvalidTimeFormatException;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.MONDAY;
import static sp.sistemaspalacios.api_homecare.ComplianceTestFixtures.presenceNight;

class NightHoursServiceTest {

    private final NightHoursService service = ComplianceTestFixtures.engine().nightHoursService();

    @ParameterizedTest(name = "{0}-{1} -> {2}h")
    @CsvSource({
            "20:00, 22:00, 1.0",
            "21:00, 06:00, 9.0",
            "23:00, 07:00, 7.0",
            "02:00, 05:00, 3.0",
            "05:00, 08:00, 1.0",
            "08:00, 17:00, 0.0",
            "18:00, 18:00, 9.0"
    })
    void countsOnlyTheOverlapWithTheNightWindow(String start, String end, double expected) {
        assertThat(service.calculateNightHours(MONDAY, start, end)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void shiftOverloadUsesItsOwnTimes() {
        assertThat(service.calculateNightHours(presenceNight("n1", MONDAY, "22:00", "07:00", 0)))
                .isCloseTo(8.0, within(1e-9));
    }

    @Test
    void nightWindowIsConfigurable() {
        LaborAgreement agreement = LaborAgreement.builder()
                .nightStart(LocalTime.of(22, 0))
                .nightEnd(LocalTime.of(7, 0))
                .build();
        NightHoursService custom = ComplianceTestFixtures.engine(agreement).nightHoursService();

        assertThat(custom.calculateNightHours(MONDAY, "20:00", "23:00")).isCloseTo(1.0, within(1e-9));
        assertThat(custom.calculateNightHours(MONDAY, "05:00", "08:00")).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void malformedTimeIsRejected() {
        assertThatThrownBy(() -> service.calculateNightHours(MONDAY, "25:00", "06:00"))
                .isInstanceOf(InvalidTimeFormatException.class);
    }
}
