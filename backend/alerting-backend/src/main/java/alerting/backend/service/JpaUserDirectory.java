package alerting.backend.service;

import alerting.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    public Set<String> listUsers() {
        return new LinkedHashSet<>(userRepository.findAllIds());
    }

    @Override
    public Set<String> teamMembers(String teamId) {
        if (teamId == null) return Set.of();
        return new LinkedHashSet<>(userRepository.findIdsByTeamId(teamId));
    }
}
