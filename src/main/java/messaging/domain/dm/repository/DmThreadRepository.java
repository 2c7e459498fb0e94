package messaging.domain.dm.repository;

import messaging.domain.dm.entity.DmThread;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DmThreadRepository extends JpaRepository<DmThread, Long> {

    /**
     * 정렬된 (user1Id &lt; user2Id) 쌍으로 스레드를 찾습니다.
     */
    @Query("SELECT t FROM DmThread t JOIN FETCH t.user1 JOIN FETCH t.user2 " +
            "WHERE t.user1.id = :user1Id AND t.user2.id = :user2Id")
    Optional<DmThread> findPair(@Param("user1Id") Long user1Id, @Param("user2Id") Long user2Id);

    @Query("SELECT t FROM DmThread t JOIN FETCH t.user1 JOIN FETCH t.user2 WHERE t.id = :threadId")
    Optional<DmThread> findByIdWithUsers(@Param("threadId") Long threadId);

    @Query("SELECT t FROM DmThread t JOIN FETCH t.user1 JOIN FETCH t.user2 " +
            "WHERE t.user1.id = :userId OR t.user2.id = :userId")
    List<DmThread> findAllWithUsersByParticipant(@Param("userId") Long userId);

    @Query("SELECT CASE WHEN COUNT(t) > 0 THEN true ELSE false END FROM DmThread t " +
            "WHERE t.id = :threadId AND (t.user1.id = :userId OR t.user2.id = :userId)")
    boolean existsParticipant(@Param("threadId") Long threadId, @Param("userId") Long userId);
}
