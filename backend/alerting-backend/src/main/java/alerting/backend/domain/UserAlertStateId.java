package alerting.backend.domain;

import lombok.*;

import java.io.Serializable;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class UserAlertStateId implements Serializable {
    private String userId;
    private Long alertId;
}
