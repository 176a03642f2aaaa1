package sp.sistemaspalacios.api_homecare.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        log.warn("⚠️ Petición inválida: {}", errors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR",
                "Données de la requête invalides",
                errors,
                LocalDateTime.now()));
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
        Map<String, String> details = ex.getField() == null ? null : Map.of(ex.getField(), ex.getMessage());

        log.warn("⚠️ Entrada mal formada: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ex instanceof InvalidTimeFormatException ? "INVALID_TIME_FORMAT" : "INVALID_INPUT",
                ex.getMessage(),
                details,
                LocalDateTime.now()));
    }

    // Jackson envuelve las excepciones lanzadas en @JsonCreator
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof InvalidInputException invalid) {
            return handleInvalidInput(invalid);
        }

        log.warn("⚠️ JSON ilegible: {}", cause.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "MALFORMED_JSON",
                "Corps de requête illisible",
                null,
                LocalDateTime.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("❌ Error inesperado", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                "INTERNAL_ERROR",
                "Une erreur inattendue est survenue",
                null,
                LocalDateTime.now()));
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
