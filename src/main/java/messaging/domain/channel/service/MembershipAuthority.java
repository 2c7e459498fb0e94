package messaging.domain.channel.service;

import lombok.RequiredArgsConstructor;
import messaging.domain.channel.repository.ChannelMembershipRepository;
import messaging.domain.dm.repository.DmThreadRepository;
import messaging.global.enums.ErrorCode;
import messaging.global.enums.MembershipRole;
import messaging.global.exception.BusinessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 채널 멤버십과 DM 참여 여부를 판단하는 단일 지점.
 * <p>
 * 멤버는 읽기, 전송, 멤버 추가가 가능하고 관리자만 이름 변경과 다른 멤버 제거가 가능하다.
 * 판단은 매번 저장소를 조회하며 캐시하지 않는다.
 */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MembershipAuthority {

    private final ChannelMembershipRepository membershipRepository;
    private final DmThreadRepository dmThreadRepository;

    public boolean isChannelMember(Long channelId, Long userId) {
        if (channelId == null || userId == null) {
            return false;
        }
        return membershipRepository.existsByChannelIdAndUserId(channelId, userId);
    }

    public boolean isChannelAdmin(Long channelId, Long userId) {
        if (channelId == null || userId == null) {
            return false;
        }
        return membershipRepository.existsByChannelIdAndUserIdAndRole(channelId, userId, MembershipRole.ADMIN);
    }

    public boolean isThreadParticipant(Long threadId, Long userId) {
        if (threadId == null || userId == null) {
            return false;
        }
        return dmThreadRepository.existsParticipant(threadId, userId);
    }

    public void requireChannelMember(Long channelId, Long userId) {
        if (!isChannelMember(channelId, userId)) {
            throw new BusinessException(ErrorCode.NOT_CHANNEL_MEMBER);
        }
    }

    public void requireChannelAdmin(Long channelId, Long userId) {
        if (!isChannelAdmin(channelId, userId)) {
            throw new BusinessException(ErrorCode.NOT_CHANNEL_ADMIN);
        }
    }

    public void requireThreadParticipant(Long threadId, Long userId) {
        if (!isThreadParticipant(threadId, userId)) {
            throw new BusinessException(ErrorCode.NOT_THREAD_PARTICIPANT);
        }
    }
}
