package alerting.backend.repository;

import alerting.backend.domain.ReadStatus;
import alerting.backend.domain.UserAlertState;
import alerting.backend.domain.UserAlertStateId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserAlertStateRepository extends JpaRepository<UserAlertState, UserAlertStateId> {

    Optional<UserAlertState> findByUserIdAndAlertId(String userId, Long alertId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM UserAlertState s WHERE s.userId = :userId AND s.alertId = :alertId")
    Optional<UserAlertState> findWithLock(@Param("userId") String userId,
                                          @Param("alertId") Long alertId);

    List<UserAlertState> findByUserIdAndAlertIdIn(String userId, List<Long> alertIds);

    List<UserAlertState> findByAlertId(Long alertId);

    long countByReadStatus(ReadStatus readStatus);

    @Query("SELECT COUNT(s) FROM UserAlertState s WHERE s.snoozedUntil IS NOT NULL AND s.snoozedUntil > :now")
    long countSnoozed(@Param("now") LocalDateTime now);
}
