package alerting.backend.service;

import alerting.backend.domain.DeliveryAttempt;
import alerting.backend.domain.DeliveryKind;
import alerting.backend.repository.DeliveryAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
public class DeliveryLogService {

    private static final int MAX_ERROR_LENGTH = 512;

    private final DeliveryAttemptRepository attemptRepository;
    private final Clock clock;

    // own transaction: also called from after-commit listeners where the caller's transaction is finished
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(Long alertId, String userId, String channel, DeliveryKind kind,
                       boolean success, String error) {
        attemptRepository.save(DeliveryAttempt.builder()
                .alertId(alertId)
                .userId(userId)
                .channel(channel)
                .kind(kind)
                .success(success)
                .errorMessage(truncate(error))
                .attemptedAt(LocalDateTime.now(clock))
                .build());
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) return error;
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
