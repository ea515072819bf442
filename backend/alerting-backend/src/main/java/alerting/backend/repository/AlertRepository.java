package alerting.backend.repository;

import alerting.backend.domain.Alert;
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
public interface AlertRepository extends JpaRepository<Alert, Long> {

    List<Alert> findAllByOrderByIdAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Alert a WHERE a.id = :id")
    Optional<Alert> findWithLockById(@Param("id") Long id);

    // active, started and unexpired; with reminders on, or with a target still waiting for its first send
    @Query("""
      SELECT a FROM Alert a
      WHERE a.status = alerting.backend.domain.AlertStatus.ACTIVE
        AND a.startAt <= :now
        AND (a.expiresAt IS NULL OR a.expiresAt > :now)
        AND (a.remindersEnabled = true
             OR EXISTS (SELECT s FROM UserAlertState s
                        WHERE s.alertId = a.id AND s.lastNotifiedAt IS NULL))
      ORDER BY a.id
    """)
    List<Alert> findTickCandidates(@Param("now") LocalDateTime now);

    @Query("""
      SELECT a FROM Alert a
      WHERE a.status = alerting.backend.domain.AlertStatus.ACTIVE
        AND (a.expiresAt IS NULL OR a.expiresAt > :now)
      ORDER BY a.id
    """)
    List<Alert> findActive(@Param("now") LocalDateTime now);

    @Query("SELECT a.severity, COUNT(a) FROM Alert a GROUP BY a.severity")
    List<Object[]> countBySeverity();

    @Query("SELECT a.status, COUNT(a) FROM Alert a GROUP BY a.status")
    List<Object[]> countByStatus();

    @Query("""
      SELECT COUNT(a) FROM Alert a
      WHERE a.status = alerting.backend.domain.AlertStatus.ACTIVE
        AND (a.expiresAt IS NULL OR a.expiresAt > :now)
    """)
    long countActive(@Param("now") LocalDateTime now);

    @Query("""
      SELECT COUNT(a) FROM Alert a
      WHERE a.status = alerting.backend.domain.AlertStatus.ACTIVE
        AND a.expiresAt IS NOT NULL AND a.expiresAt <= :now
    """)
    long countExpired(@Param("now") LocalDateTime now);
}
