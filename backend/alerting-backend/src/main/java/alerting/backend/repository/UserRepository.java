package alerting.backend.repository;

import alerting.backend.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface UserRepository extends JpaRepository<User, String> {

    @Query("SELECT u.id FROM User u")
    List<String> findAllIds();

    @Query("SELECT u.id FROM User u WHERE u.teamId = :teamId")
    List<String> findIdsByTeamId(@Param("teamId") String teamId);

    List<User> findAllByOrderByIdAsc();
}
