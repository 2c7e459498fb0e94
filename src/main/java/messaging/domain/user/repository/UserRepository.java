package messaging.domain.user.repository;

import messaging.domain.user.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    List<User> findAllByIdNotOrderByNameAsc(Long id);

    Optional<User> findByEmail(String email);
}
