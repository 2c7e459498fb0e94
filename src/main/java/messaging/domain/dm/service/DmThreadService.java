package messaging.domain.dm.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.domain.dm.dto.DmThreadResponse;
import messaging.domain.dm.entity.DmThread;
import messaging.domain.dm.repository.DmThreadRepository;
import messaging.domain.user.entity.User;
import messaging.domain.user.repository.UserRepository;
import messaging.global.enums.ErrorCode;
import messaging.global.exception.BusinessException;
import messaging.global.metrics.MessagingMetrics;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class DmThreadService {

    private final DmThreadRepository dmThreadRepository;
    private final UserRepository userRepository;
    private final MessagingMetrics metrics;

    /**
     * 두 사용자 사이의 DM 스레드를 찾거나 새로 만듭니다. (a, b) 와 (b, a) 는 같은 스레드를 돌려준다.
     * <p>
     * 트랜잭션 없이 동작한다. 동시에 첫 DM 이 생성되면 유니크 제약에 걸린 쪽이 승자의 행을 다시 읽는다.
     *
     * @param requesterId 요청한 사용자 (응답의 other* 필드 기준)
     * @param otherUserId 상대 사용자
     */
    public DmThreadResponse getOrCreateDmThread(Long requesterId, Long otherUserId) {
        if (requesterId.equals(otherUserId)) {
            throw new BusinessException(ErrorCode.SELF_DM);
        }
        User requester = userRepository.findById(requesterId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        User other = userRepository.findById(otherUserId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));

        long user1Id = Math.min(requesterId, otherUserId);
        long user2Id = Math.max(requesterId, otherUserId);

        Optional<DmThread> existing = dmThreadRepository.findPair(user1Id, user2Id);
        if (existing.isPresent()) {
            return DmThreadResponse.of(existing.get(), requesterId);
        }

        try {
            DmThread created = dmThreadRepository.saveAndFlush(DmThread.between(requester, other));
            metrics.recordDmThreadCreated();
            log.info("DM 스레드 생성: threadId={}, user1={}, user2={}", created.getId(), user1Id, user2Id);
            return DmThreadResponse.of(created, requesterId);
        } catch (DataIntegrityViolationException e) {
            log.debug("DM 스레드 동시 생성 감지, 기존 행 재조회: user1={}, user2={}", user1Id, user2Id);
            DmThread winner = dmThreadRepository.findPair(user1Id, user2Id)
                    .orElseThrow(() -> e);
            return DmThreadResponse.of(winner, requesterId);
        }
    }

    /**
     * @apiNote 참여자가 아니면 스레드 존재 여부를 드러내지 않도록 DM_THREAD_NOT_FOUND
     */
    @Transactional(readOnly = true)
    public DmThreadResponse getDmThread(Long threadId, Long userId) {
        DmThread thread = dmThreadRepository.findByIdWithUsers(threadId)
                .filter(t -> t.hasParticipant(userId))
                .orElseThrow(() -> new BusinessException(ErrorCode.DM_THREAD_NOT_FOUND));
        return DmThreadResponse.of(thread, userId);
    }
}
