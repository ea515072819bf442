package alerting.backend.domain;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "directory_teams")
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Team {

    @Id
    @Column(name = "team_id", length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;
}
