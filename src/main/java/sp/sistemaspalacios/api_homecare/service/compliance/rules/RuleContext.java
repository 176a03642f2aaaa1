package sp.sistemaspalacios.api_homecare.service.compliance.rules;

import lombok.Getter;
import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.compliance.NotEvaluatedCheck;
import sp.sistemaspalacios.api_homecare.dto.contract.ContractDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.entity.compliance.ComplianceRule;
import sp.sistemaspalacios.api_homecare.service.common.WorkingTimeCalculatorService.Interval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Datos de una validación: el candidato anclado en la línea de tiempo y los demás
 * turnos del mismo empleado (sin el propio candidato cuando se está editando).
 */
@Getter
public class RuleContext {

    public record AnchoredShift(Shift shift, Interval interval) {
    }

    private final AnchoredShift candidate;
    private final List<AnchoredShift> siblings;
    private final List<AbsenceDTO> absences;
    private final ContractDTO contract;
    private final List<NotEvaluatedCheck> notEvaluated = new ArrayList<>();

    public RuleContext(AnchoredShift candidate, List<AnchoredShift> siblings,
                       List<AbsenceDTO> absences, ContractDTO contract) {
        this.candidate = candidate;
        List<AnchoredShift> sorted = new ArrayList<>(siblings);
        sorted.sort(Comparator.comparing(a -> a.interval().start()));
        this.siblings = Collections.unmodifiableList(sorted);
        this.absences = absences == null ? List.of() : List.copyOf(absences);
        this.contract = contract;
    }

    public Shift candidateShift() {
        return candidate.shift();
    }

    public Interval candidateInterval() {
        return candidate.interval();
    }

    /** Hermanos más el candidato, ordenados por inicio. */
    public List<AnchoredShift> withCandidate() {
        List<AnchoredShift> all = new ArrayList<>(siblings);
        all.add(candidate);
        all.sort(Comparator.comparing(a -> a.interval().start()));
        return all;
    }

    public List<Shift> siblingShifts() {
        return siblings.stream().map(AnchoredShift::shift).toList();
    }

    public void markNotEvaluated(ComplianceRule code, String reason) {
        notEvaluated.add(new NotEvaluatedCheck(code, reason));
    }
}
