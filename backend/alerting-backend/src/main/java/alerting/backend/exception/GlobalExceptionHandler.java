package alerting.backend.exception;

import alerting.backend.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(AlertingException.class)
    protected ResponseEntity<ErrorResponse> handleAlertingException(AlertingException e) {
        log.warn("Business exception: {} | {}", e.getErrorCode().getCode(), e.getMessage());
        return ErrorResponse.toResponseEntity(e, now());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    protected ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ErrorResponse.toResponseEntity(ErrorCode.INVALID_INPUT_VALUE, detail, now());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    protected ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return ErrorResponse.toResponseEntity(ErrorCode.INVALID_INPUT_VALUE, e.getMessage(), now());
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected failure", e);
        return ErrorResponse.toResponseEntity(ErrorCode.INTERNAL_SERVER_ERROR, now());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
