package alerting.backend.dto;

import alerting.backend.exception.AlertingException;
import alerting.backend.exception.ErrorCode;
import lombok.Builder;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

    @Builder
    public ErrorResponse {}

    public static ResponseEntity<ErrorResponse> toResponseEntity(AlertingException e, LocalDateTime timestamp) {
        return toResponseEntity(e.getErrorCode(), e.getMessage(), timestamp);
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, LocalDateTime timestamp) {
        return toResponseEntity(errorCode, errorCode.getMessage(), timestamp);
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String message,
                                                                 LocalDateTime timestamp) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ErrorResponse.builder()
                        .status(errorCode.getStatus().value())
                        .code(errorCode.getCode())
                        .message(message)
                        .timestamp(timestamp)
                        .build());
    }
}
