package alerting.backend.dto;

import java.util.List;

public record DispatchResult(List<String> accepted, List<String> failed) {

    public boolean anyAccepted() {
        return !accepted.isEmpty();
    }
}
