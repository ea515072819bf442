package alerting.backend.dto;

import alerting.backend.domain.ReadStatus;
import alerting.backend.domain.UserAlertState;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAlertStateResponse {
    private String userId;
    private Long alertId;
    private ReadStatus readStatus;
    private LocalDateTime readAt;
    private LocalDateTime snoozedUntil;
    private LocalDateTime lastNotifiedAt;

    public static UserAlertStateResponse from(UserAlertState s) {
        return UserAlertStateResponse.builder()
                .userId(s.getUserId())
                .alertId(s.getAlertId())
                .readStatus(s.getReadStatus())
                .readAt(s.getReadAt())
                .snoozedUntil(s.getSnoozedUntil())
                .lastNotifiedAt(s.getLastNotifiedAt())
                .build();
    }
}
