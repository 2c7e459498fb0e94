package messaging.domain.message.repository;

import messaging.domain.message.entity.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 모든 목록 조회는 (createdAt DESC, id DESC) 순서이며, 커서는 (createdAt, id) 쌍으로 비교한다.
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    @Query("SELECT m FROM Message m JOIN FETCH m.sender " +
            "WHERE m.channel.id = :channelId " +
            "ORDER BY m.createdAt DESC, m.id DESC")
    List<Message> findLatestInChannel(@Param("channelId") Long channelId, Pageable pageable);

    @Query("SELECT m FROM Message m JOIN FETCH m.sender " +
            "WHERE m.channel.id = :channelId " +
            "AND (m.createdAt < :cursorAt OR (m.createdAt = :cursorAt AND m.id < :cursorId)) " +
            "ORDER BY m.createdAt DESC, m.id DESC")
    List<Message> findInChannelBefore(@Param("channelId") Long channelId,
                                      @Param("cursorAt") Instant cursorAt,
                                      @Param("cursorId") Long cursorId,
                                      Pageable pageable);

    @Query("SELECT m FROM Message m JOIN FETCH m.sender " +
            "WHERE m.dmThread.id = :threadId " +
            "ORDER BY m.createdAt DESC, m.id DESC")
    List<Message> findLatestInDmThread(@Param("threadId") Long threadId, Pageable pageable);

    @Query("SELECT m FROM Message m JOIN FETCH m.sender " +
            "WHERE m.dmThread.id = :threadId " +
            "AND (m.createdAt < :cursorAt OR (m.createdAt = :cursorAt AND m.id < :cursorId)) " +
            "ORDER BY m.createdAt DESC, m.id DESC")
    List<Message> findInDmThreadBefore(@Param("threadId") Long threadId,
                                       @Param("cursorAt") Instant cursorAt,
                                       @Param("cursorId") Long cursorId,
                                       Pageable pageable);

    Optional<Message> findFirstByChannelIdOrderByCreatedAtDescIdDesc(Long channelId);

    Optional<Message> findFirstByDmThreadIdOrderByCreatedAtDescIdDesc(Long threadId);

    long countByChannelId(Long channelId);

    long countByDmThreadId(Long threadId);
}
