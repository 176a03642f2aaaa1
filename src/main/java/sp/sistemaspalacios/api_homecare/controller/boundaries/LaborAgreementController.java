package sp.sistemaspalacios.api_homecare.controller.boundaries;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_homecare.config.LaborAgreement;

@RestController
@RequestMapping("/api/config/labor-agreement")
public class LaborAgreementController {

    private final LaborAgreement laborAgreement;

    public LaborAgreementController(LaborAgreement laborAgreement) {
        this.laborAgreement = laborAgreement;
    }

    @GetMapping
    public ResponseEntity<LaborAgreement> getCurrent() {
        return ResponseEntity.ok(laborAgreement);
    }
}
