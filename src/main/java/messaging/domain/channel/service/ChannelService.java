package messaging.domain.channel.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.domain.channel.dto.ChannelMemberResponse;
import messaging.domain.channel.dto.ChannelResponse;
import messaging.domain.channel.entity.Channel;
import messaging.domain.channel.entity.ChannelMembership;
import messaging.domain.channel.event.ChannelRenamedEvent;
import messaging.domain.channel.repository.ChannelMembershipRepository;
import messaging.domain.channel.repository.ChannelRepository;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.service.MessageService;
import messaging.domain.user.entity.User;
import messaging.domain.user.repository.UserRepository;
import messaging.global.enums.ChannelType;
import messaging.global.enums.ErrorCode;
import messaging.global.enums.MembershipRole;
import messaging.global.exception.BusinessException;
import messaging.global.metrics.MessagingMetrics;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class ChannelService {

    private final ChannelRepository channelRepository;
    private final ChannelMembershipRepository membershipRepository;
    private final UserRepository userRepository;
    private final MembershipAuthority membershipAuthority;
    private final MessageService messageService;
    private final ApplicationEventPublisher eventPublisher;
    private final MessagingMetrics metrics;

    @Transactional
    public ChannelResponse createChannel(String name, ChannelType type, Long creatorId) {
        return createChannel(name, type, creatorId, List.of());
    }

    /**
     * 채널을 만들고 생성자를 유일한 관리자로 등록합니다. 초기 멤버는 같은 트랜잭션에서 MEMBER 로 추가된다.
     *
     * @param initialMemberIds 함께 추가할 사용자 ID. 생성자 ID 와 중복은 무시한다.
     * @apiNote 존재하지 않는 사용자가 섞여 있으면 USER_NOT_FOUND 로 전체가 롤백된다.
     */
    @Transactional
    public ChannelResponse createChannel(String name, ChannelType type, Long creatorId,
                                         Collection<Long> initialMemberIds) {
        String trimmed = requireName(name);
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST);
        }
        User creator = userRepository.findById(creatorId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));

        Channel channel = channelRepository.save(new Channel(trimmed, type, creator));
        membershipRepository.save(ChannelMembership.admin(channel, creator));

        Set<Long> memberIds = new LinkedHashSet<>();
        if (initialMemberIds != null) {
            initialMemberIds.stream().filter(Objects::nonNull).forEach(memberIds::add);
        }
        memberIds.remove(creatorId);
        for (Long memberId : memberIds) {
            User member = userRepository.findById(memberId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
            membershipRepository.save(ChannelMembership.member(channel, member));
        }

        metrics.recordChannelCreated(type);
        log.info("채널 생성: channelId={}, creatorId={}, initialMembers={}", channel.getId(), creatorId, memberIds.size());
        return ChannelResponse.of(channel, memberIds.size() + 1L);
    }

    /**
     * 멤버를 추가하고 "A added B to the channel" 시스템 메시지를 남깁니다.
     *
     * @return 생성된 시스템 메시지
     */
    @Transactional
    public MessageResponse addMemberToChannel(Long channelId, Long targetUserId, Long actorId) {
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_NOT_FOUND));
        membershipAuthority.requireChannelMember(channelId, actorId);

        User target = userRepository.findById(targetUserId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        if (membershipAuthority.isChannelMember(channelId, targetUserId)) {
            throw new BusinessException(ErrorCode.ALREADY_CHANNEL_MEMBER);
        }
        User actor = userRepository.findById(actorId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));

        membershipRepository.save(ChannelMembership.member(channel, target));
        log.info("채널 멤버 추가: channelId={}, actorId={}, targetId={}", channelId, actorId, targetUserId);

        return messageService.sendSystemMessage(channelId, actorId,
                actor.getName() + " added " + target.getName() + " to the channel");
    }

    /**
     * 관리자가 다른 멤버를 제거합니다. 제거된 사용자도 conversation_update 를 받는다.
     *
     * @apiNote 자기 자신은 제거할 수 없다 (CANNOT_REMOVE_SELF).
     */
    @Transactional
    public MessageResponse removeMemberFromChannel(Long channelId, Long targetUserId, Long actorId) {
        if (Objects.equals(targetUserId, actorId)) {
            throw new BusinessException(ErrorCode.CANNOT_REMOVE_SELF);
        }
        if (!channelRepository.existsById(channelId)) {
            throw new BusinessException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        membershipAuthority.requireChannelAdmin(channelId, actorId);

        ChannelMembership membership = membershipRepository.findByChannelIdAndUserId(channelId, targetUserId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_MEMBER_NOT_FOUND));
        User target = membership.getUser();
        User actor = userRepository.findById(actorId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        String text = actor.getName() + " removed " + target.getName() + " from the channel";

        membershipRepository.delete(membership);
        membershipRepository.flush();
        log.info("채널 멤버 제거: channelId={}, actorId={}, targetId={}", channelId, actorId, targetUserId);

        return messageService.sendSystemMessage(channelId, actorId, text, List.of(targetUserId));
    }

    /**
     * 관리자만 채널 이름을 바꿀 수 있습니다. 권한 확인과 변경은 하나의 조건부 UPDATE 로 수행된다.
     *
     * @apiNote 변경된 행이 없으면 채널이 없을 때 CHANNEL_NOT_FOUND, 그 외에는 NOT_CHANNEL_ADMIN
     */
    @Transactional
    public ChannelResponse renameChannel(Long channelId, String newName, Long actorId) {
        String trimmed = requireName(newName);

        int updated = channelRepository.renameIfAdmin(channelId, trimmed, actorId, MembershipRole.ADMIN);
        if (updated == 0) {
            if (!channelRepository.existsById(channelId)) {
                throw new BusinessException(ErrorCode.CHANNEL_NOT_FOUND);
            }
            throw new BusinessException(ErrorCode.NOT_CHANNEL_ADMIN);
        }

        User actor = userRepository.findById(actorId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        messageService.sendSystemMessage(channelId, actorId,
                actor.getName() + " renamed the channel to \"" + trimmed + "\"");

        List<Long> memberIds = membershipRepository.findUserIdsByChannelId(channelId);
        eventPublisher.publishEvent(new ChannelRenamedEvent(channelId, trimmed, actorId, memberIds));
        log.info("채널 이름 변경: channelId={}, actorId={}", channelId, actorId);

        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_NOT_FOUND));
        return ChannelResponse.of(channel, memberIds.size());
    }

    /**
     * @apiNote 멤버가 아니면 채널 존재 여부를 드러내지 않도록 CHANNEL_NOT_FOUND
     */
    @Transactional(readOnly = true)
    public ChannelResponse getChannel(Long channelId, Long userId) {
        if (!membershipAuthority.isChannelMember(channelId, userId)) {
            throw new BusinessException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_NOT_FOUND));
        return ChannelResponse.of(channel, membershipRepository.countByChannelId(channelId));
    }

    @Transactional(readOnly = true)
    public List<ChannelMemberResponse> getChannelMembers(Long channelId, Long userId) {
        if (!membershipAuthority.isChannelMember(channelId, userId)) {
            return List.of();
        }
        return membershipRepository.findMembersWithUser(channelId).stream()
                .map(ChannelMemberResponse::from)
                .toList();
    }

    private static String requireName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_CHANNEL_NAME);
        }
        return trimmed;
    }
}
