package alerting.backend.repository;

import alerting.backend.domain.InboxEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface InboxEntryRepository extends JpaRepository<InboxEntry, Long> {

    List<InboxEntry> findByUserIdOrderByDeliveredAtDescIdDesc(String userId);
}
