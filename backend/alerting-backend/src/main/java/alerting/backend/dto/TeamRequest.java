package alerting.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TeamRequest {
    @NotBlank
    private String id;
    @NotBlank
    private String name;
}
