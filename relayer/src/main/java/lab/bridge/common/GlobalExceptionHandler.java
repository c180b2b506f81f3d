package lab.bridge.common;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // Pre-images, private keys and signed payloads are at least 32 bytes of hex.
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("0x[a-fA-F0-9]{64,}");

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        List<String> allowedValues = allowedValues(ex.getRequiredType());
        String message = allowedValues.isEmpty()
                ? "Invalid value '%s' for '%s'".formatted(ex.getValue(), ex.getName())
                : "Unsupported %s '%s'. Allowed values: %s".formatted(ex.getName(), ex.getValue(), String.join(", ", allowedValues));

        return ResponseEntity.badRequest().body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message, allowedValues));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        ErrorResponse body = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                sanitizeMessage(ex.getMessage()),
                List.of()
        );
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + sanitizeMessage(detail);
        }

        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(new ErrorResponse(HttpStatus.BAD_REQUEST.value(), message, List.of()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        String message = sanitizeMessage(ex.getMessage());
        log.error("event=http.unhandled path={} type={} message={}", request.getRequestURI(), ex.getClass().getSimpleName(), message);
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                message,
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("0x[REDACTED]");
    }

    private static List<String> allowedValues(Class<?> type) {
        if (type == null || !type.isEnum()) {
            return List.of();
        }
        return Arrays.stream(type.getEnumConstants())
                .map(value -> ((Enum<?>) value).name())
                .toList();
    }

    public record ErrorResponse(
            int status,
            String message,
            List<String> allowedValues
    ) {}

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {
    }
}
