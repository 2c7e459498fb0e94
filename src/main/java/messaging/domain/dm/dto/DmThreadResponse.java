package messaging.domain.dm.dto;

import messaging.domain.dm.entity.DmThread;
import messaging.domain.user.entity.User;

import java.time.Instant;

public record DmThreadResponse(
        Long id,
        Long user1Id,
        Long user2Id,
        Instant createdAt,
        Long otherUserId,
        String otherUserName,
        String otherUserEmail) {

    /**
     * viewerId 기준으로 상대방 정보를 채운다. user1, user2 가 초기화되어 있어야 한다.
     */
    public static DmThreadResponse of(DmThread thread, Long viewerId) {
        User other = thread.otherParticipant(viewerId);
        return new DmThreadResponse(
                thread.getId(),
                thread.getUser1().getId(),
                thread.getUser2().getId(),
                thread.getCreatedAt(),
                other.getId(),
                other.getName(),
                other.getEmail()
        );
    }
}
