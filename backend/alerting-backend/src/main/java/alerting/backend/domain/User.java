package alerting.backend.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
        name = "directory_users",
        indexes = {
                @Index(name = "idx_user_team", columnList = "team_id")
        }
)
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @Column(name = "user_id", length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 255)
    private String email;

    @Column(name = "team_id", length = 64)
    private String teamId;
}
