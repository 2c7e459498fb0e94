package messaging.domain.dm.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import messaging.domain.user.entity.User;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 두 사용자 사이의 1:1 대화. (user1, user2) 는 항상 id 오름차순으로 저장되어
 * 같은 쌍에 대해 행이 하나만 존재한다.
 */
@Entity
@Table(
        name = "dm_threads",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_dm_thread_pair",
                columnNames = {"user1_id", "user2_id"}
        )
)
@Check(name = "ck_dm_thread_ordered_pair", constraints = "user1_id < user2_id")
@Getter
@NoArgsConstructor
public class DmThread {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dm_thread_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user1_id", nullable = false)
    private User user1;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user2_id", nullable = false)
    private User user2;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private DmThread(User user1, User user2) {
        this.user1 = user1;
        this.user2 = user2;
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public static DmThread between(User a, User b) {
        if (a.getId().equals(b.getId())) {
            throw new IllegalArgumentException("같은 사용자끼리는 DM 스레드를 만들 수 없습니다.");
        }
        return a.getId() < b.getId() ? new DmThread(a, b) : new DmThread(b, a);
    }

    public boolean hasParticipant(Long userId) {
        return user1.getId().equals(userId) || user2.getId().equals(userId);
    }

    public User otherParticipant(Long userId) {
        return user1.getId().equals(userId) ? user2 : user1;
    }
}
