package czm.carwash_be.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("API error {}: {}", ex.getCode(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(ex.getStatus()).body(ApiErrorResponse.of(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "BAD_REQUEST",
                ex.getMessage() != null ? ex.getMessage() : "Neplatný vstup.",
                null,
                HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        ApiErrorResponse body = ApiErrorResponse.of(
                "VALIDATION",
                "Neplatný vstup. Zkontrolujte zadané parametry.",
                ex.getMessage(),
                HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateKeyException ex) {
        // Souběžný insert předběhl kontrolu unikátnosti v servisní vrstvě.
        ApiErrorResponse body = ApiErrorResponse.of(
                "CONFLICT",
                "Záznam se stejným označením již existuje.",
                truncate(ex.getMostSpecificCause().getMessage(), 500),
                HttpStatus.CONFLICT);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleIntegrity(DataIntegrityViolationException ex) {
        // Hodnota prošla servisní validací, ale narazila na omezení ve schématu.
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        ApiErrorResponse body = ApiErrorResponse.of(
                "VALIDATION",
                "Zadané hodnoty nesplňují omezení databáze.",
                truncate(ex.getMostSpecificCause().getMessage(), 500),
                HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database access failed", ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "STORE_UNAVAILABLE",
                "Databáze je teď nedostupná. Zkuste to prosím znovu.",
                truncate(ex.getMostSpecificCause().getMessage(), 500),
                HttpStatus.SERVICE_UNAVAILABLE);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "UNKNOWN",
                "Nastala neočekávaná chyba. Zkuste to znovu nebo kontaktujte správce.",
                ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static String truncate(String s, int max) { if (s == null) return null; return s.length() <= max ? s : s.substring(0, max) + "..."; }
}
