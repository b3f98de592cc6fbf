package microservices.helper.monkeyregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import lombok.extern.slf4j.Slf4j;
import microservices.helper.monkeyregistry.enums.ErrorCode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.error("Validation failed for field {}: {}", ex.getField(), ex.getMessage());

        ErrorResponse errorResponse = errorResponse(ex.getMessage(), ex.getErrorCode().getValue())
                .field(ex.getField())
                .build();
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(MonkeyRegistryException.class)
    public ResponseEntity<ErrorResponse> handleMonkeyRegistryException(MonkeyRegistryException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Monkey registry failure: {}", ex.getMessage(), ex);
        } else {
            log.error("Monkey registry request rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
        }

        return ResponseEntity.status(status)
                .body(errorResponse(ex.getMessage(), ex.getErrorCode().getValue()).build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.error("Request validation failed: {}", errors);

        ErrorResponse errorResponse = errorResponse("Validation failed", ErrorCode.VALIDATION_ERROR.getValue())
                .validationErrors(errors)
                .build();
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.error("Unreadable request body: {}", ex.getMessage());

        ErrorResponse.ErrorResponseBuilder errorResponse =
                errorResponse("Malformed request body", ErrorCode.VALIDATION_ERROR.getValue());
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            String field = mismatch.getPath().get(mismatch.getPath().size() - 1).getFieldName();
            if (field != null) {
                errorResponse.message(field + " has an invalid type").field(field);
            }
        }
        return ResponseEntity.badRequest().body(errorResponse.build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected exception occurred: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorResponse("An unexpected error occurred", INTERNAL_ERROR).build());
    }

    private static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case DUPLICATE_NAME, DUPLICATE_ID, EXPORT_TARGET_EXISTS -> HttpStatus.CONFLICT;
            case STORAGE_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            case VALIDATION_ERROR, INVALID_IMPORT_FILE -> HttpStatus.BAD_REQUEST;
        };
    }

    private static ErrorResponse.ErrorResponseBuilder errorResponse(String message, String errorCode) {
        return ErrorResponse.builder()
                .timestamp(Instant.now())
                .message(message)
                .errorCode(errorCode);
    }
}
