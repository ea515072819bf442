package alerting.backend.service;

import alerting.backend.dto.InboxEntryResponse;
import alerting.backend.repository.InboxEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InboxService {

    private final InboxEntryRepository inboxRepository;

    public List<InboxEntryResponse> inbox(String userId) {
        return inboxRepository.findByUserIdOrderByDeliveredAtDescIdDesc(userId).stream()
                .map(InboxEntryResponse::from)
                .toList();
    }
}
