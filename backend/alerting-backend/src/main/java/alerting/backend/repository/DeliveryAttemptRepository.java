package alerting.backend.repository;

import alerting.backend.domain.DeliveryAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface DeliveryAttemptRepository extends JpaRepository<DeliveryAttempt, Long> {

    @Query("""
      SELECT d.channel, d.success, COUNT(d) FROM DeliveryAttempt d
      GROUP BY d.channel, d.success
    """)
    List<Object[]> countByChannelAndSuccess();
}
