package sp.sistemaspalacios.api_homecare.validator.shift;

import sp.sistemaspalacios.api_homecare.dto.absence.AbsenceDTO;
import sp.sistemaspalacios.api_homecare.dto.shift.Guard24hShift;
import sp.sistemaspalacios.api_homecare.dto.shift.GuardSegment;
import sp.sistemaspalacios.api_homecare.dto.shift.PresenceNightShift;
import sp.sistemaspalacios.api_homecare.dto.shift.Shift;
import sp.sistemaspalacios.api_homecare.exception.InvalidInputException;
import sp.sistemaspalacios.api_homecare.exception.InvalidTimeFormatException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rechaza entradas mal formadas antes de evaluar reglas. Nunca corrige: si algo
 * no cuadra, lanza {@link InvalidInputException}.
 */
public final class ShiftInputValidator {

    private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private ShiftInputValidator() {
    }

    public static void validateShift(Shift shift) {
        // ==========================================
        // PASO 1: CAMPOS OBLIGATORIOS
        // ==========================================

        if (shift == null) {
            throw new InvalidInputException("shift", "L'intervention est obligatoire.");
        }
        if (shift.employeeId() == null || shift.employeeId().isBlank()) {
            throw new InvalidInputException("employeeId", "L'auxiliaire de l'intervention est obligatoire.");
        }
        if (shift.date() == null) {
            throw new InvalidInputException("date", "La date de l'intervention est obligatoire.");
        }

        // ==========================================
        // PASO 2: FORMATO DE HORAS
        // ==========================================

        validateTime("startTime", shift.startTime());
        validateTime("endTime", shift.endTime());

        // ==========================================
        // PASO 3: VALORES NUMÉRICOS Y VARIANTES
        // ==========================================

        if (shift.breakDuration() < 0) {
            throw new InvalidInputException("breakDuration",
                    "La pause ne peut pas être négative : " + shift.breakDuration());
        }

        if (shift instanceof PresenceNightShift night && night.nightInterventionsCount() < 0) {
            throw new InvalidInputException("nightInterventionsCount",
                    "Le nombre d'interventions de nuit ne peut pas être négatif : " + night.nightInterventionsCount());
        }

        if (shift instanceof Guard24hShift guard) {
            for (GuardSegment segment : guard.guardSegments()) {
                if (segment == null || segment.type() == null) {
                    throw new InvalidInputException("guardSegments", "Chaque segment de garde doit avoir un type.");
                }
                validateTime("guardSegments.startTime", segment.startTime());
            }
        }
    }

    public static void validateShifts(List<? extends Shift> shifts) {
        if (shifts == null) return;
        shifts.forEach(ShiftInputValidator::validateShift);
    }

    public static void validateAbsence(AbsenceDTO absence) {
        if (absence == null) {
            throw new InvalidInputException("absence", "L'absence est obligatoire.");
        }
        if (absence.getStartDate() == null || absence.getEndDate() == null) {
            throw new InvalidInputException("absence", "Les dates de début et de fin de l'absence sont obligatoires.");
        }
        if (absence.getEndDate().isBefore(absence.getStartDate())) {
            throw new InvalidInputException("absence.endDate",
                    String.format("L'absence %s se termine (%s) avant de commencer (%s).",
                            absence.getId(), absence.getEndDate(), absence.getStartDate()));
        }
    }

    public static void validateAbsences(List<AbsenceDTO> absences) {
        if (absences == null) return;
        absences.forEach(ShiftInputValidator::validateAbsence);
    }

    private static void validateTime(String field, String value) {
        if (value == null || !HH_MM.matcher(value.trim()).matches()) {
            throw new InvalidTimeFormatException(field, value, null);
        }
    }
}
