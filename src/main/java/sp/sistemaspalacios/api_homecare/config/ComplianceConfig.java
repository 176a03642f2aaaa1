package sp.sistemaspalacios.api_homecare.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(LaborAgreementProperties.class)
public class ComplianceConfig {

    @Bean
    public LaborAgreement laborAgreement(LaborAgreementProperties properties) {
        LaborAgreement agreement = properties.toLaborAgreement();
        log.info("⚖️ Convenio cargado: noche {}-{}, recalificación ≥ {}, semana {}h/{}h",
                agreement.getNightStart(), agreement.getNightEnd(),
                agreement.getRequalificationThreshold(),
                agreement.getWeeklyHoursWarning(), agreement.getWeeklyHoursCritical());
        return agreement;
    }
}
