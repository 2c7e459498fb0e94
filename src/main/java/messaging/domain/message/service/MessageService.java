package messaging.domain.message.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.domain.channel.entity.Channel;
import messaging.domain.channel.repository.ChannelMembershipRepository;
import messaging.domain.channel.repository.ChannelRepository;
import messaging.domain.channel.service.MembershipAuthority;
import messaging.domain.dm.entity.DmThread;
import messaging.domain.dm.repository.DmThreadRepository;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.entity.ConversationRef;
import messaging.domain.message.entity.Message;
import messaging.domain.message.event.MessageCreatedEvent;
import messaging.domain.message.repository.MessageRepository;
import messaging.domain.user.entity.User;
import messaging.domain.user.repository.UserRepository;
import messaging.global.enums.ErrorCode;
import messaging.global.exception.BusinessException;
import messaging.global.metrics.MessagingMetrics;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class MessageService {

    public static final int MESSAGE_PAGE_SIZE = 50;

    private final MessageRepository messageRepository;
    private final ChannelRepository channelRepository;
    private final ChannelMembershipRepository membershipRepository;
    private final DmThreadRepository dmThreadRepository;
    private final UserRepository userRepository;
    private final MembershipAuthority membershipAuthority;
    private final ApplicationEventPublisher eventPublisher;
    private final MessagingMetrics metrics;

    /**
     * 채널에 메시지를 보냅니다.
     *
     * @param channelId 채널 ID
     * @param senderId  보낸 사람 ID (인증된 사용자)
     * @param body      본문. 앞뒤 공백을 제거한 뒤 비어 있으면 거절된다.
     * @param imageUrl  첨부 이미지 URL (선택)
     * @return 저장된 메시지 (보낸 사람 이름, 이메일 포함)
     * @apiNote 멤버가 아니면 NOT_CHANNEL_MEMBER, 이 경우 아무 것도 저장되지 않는다.
     */
    @Transactional
    public MessageResponse sendChannelMessage(Long channelId, Long senderId, String body, String imageUrl) {
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_NOT_FOUND));
        membershipAuthority.requireChannelMember(channelId, senderId);
        String trimmed = requireBody(body);

        User sender = userRepository.findById(senderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        Message saved = messageRepository.save(Message.inChannel(channel, sender, trimmed, normalizeUrl(imageUrl)));

        return publish(saved, membershipRepository.findUserIdsByChannelId(channelId));
    }

    /**
     * DM 스레드에 메시지를 보냅니다. 계약은 채널 전송과 같다.
     *
     * @apiNote 참여자가 아니면 NOT_THREAD_PARTICIPANT
     */
    @Transactional
    public MessageResponse sendDmMessage(Long threadId, Long senderId, String body, String imageUrl) {
        DmThread thread = dmThreadRepository.findByIdWithUsers(threadId)
                .orElseThrow(() -> new BusinessException(ErrorCode.DM_THREAD_NOT_FOUND));
        membershipAuthority.requireThreadParticipant(threadId, senderId);
        String trimmed = requireBody(body);

        User sender = thread.getUser1().getId().equals(senderId) ? thread.getUser1() : thread.getUser2();
        Message saved = messageRepository.save(Message.inDmThread(thread, sender, trimmed, normalizeUrl(imageUrl)));

        return publish(saved, List.of(thread.getUser1().getId(), thread.getUser2().getId()));
    }

    /**
     * 멤버십 변경, 이름 변경 흐름에서 남기는 시스템 메시지. 본문 검사는 하지 않는다.
     * 호출자가 권한 검사를 마친 상태여야 한다.
     */
    @Transactional
    public MessageResponse sendSystemMessage(Long channelId, Long actorId, String text) {
        return sendSystemMessage(channelId, actorId, text, List.of());
    }

    /**
     * @param extraRecipientIds 현재 멤버는 아니지만 conversation_update 를 받아야 하는 사용자 (예: 방금 제거된 멤버)
     */
    @Transactional
    public MessageResponse sendSystemMessage(Long channelId, Long actorId, String text,
                                             Collection<Long> extraRecipientIds) {
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CHANNEL_NOT_FOUND));
        User actor = userRepository.findById(actorId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        Message saved = messageRepository.save(Message.system(channel, actor, text));

        Set<Long> recipients = new LinkedHashSet<>(membershipRepository.findUserIdsByChannelId(channelId));
        recipients.addAll(extraRecipientIds);
        return publish(saved, new ArrayList<>(recipients));
    }

    /**
     * 채널 메시지를 최신 순으로 최대 50개 가져와 오래된 것부터 반환합니다.
     *
     * @param before 이 메시지보다 오래된 메시지만 조회 (null 이면 최신부터)
     * @apiNote 멤버가 아니면 빈 목록을 돌려준다.
     */
    @Transactional(readOnly = true)
    public List<MessageResponse> getChannelMessages(Long channelId, Long userId, Long before) {
        if (!channelRepository.existsById(channelId)) {
            throw new BusinessException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        if (!membershipAuthority.isChannelMember(channelId, userId)) {
            return List.of();
        }

        PageRequest page = PageRequest.of(0, MESSAGE_PAGE_SIZE);
        List<Message> messages;
        if (before == null) {
            messages = messageRepository.findLatestInChannel(channelId, page);
        } else {
            Message cursor = requireCursor(before, new ConversationRef.ChannelRef(channelId));
            messages = messageRepository.findInChannelBefore(channelId, cursor.getCreatedAt(), cursor.getId(), page);
        }
        return toChronological(messages);
    }

    @Transactional(readOnly = true)
    public List<MessageResponse> getDmMessages(Long threadId, Long userId, Long before) {
        if (!dmThreadRepository.existsById(threadId)) {
            throw new BusinessException(ErrorCode.DM_THREAD_NOT_FOUND);
        }
        if (!membershipAuthority.isThreadParticipant(threadId, userId)) {
            return List.of();
        }

        PageRequest page = PageRequest.of(0, MESSAGE_PAGE_SIZE);
        List<Message> messages;
        if (before == null) {
            messages = messageRepository.findLatestInDmThread(threadId, page);
        } else {
            Message cursor = requireCursor(before, new ConversationRef.DmThreadRef(threadId));
            messages = messageRepository.findInDmThreadBefore(threadId, cursor.getCreatedAt(), cursor.getId(), page);
        }
        return toChronological(messages);
    }

    private MessageResponse publish(Message saved, List<Long> recipientIds) {
        MessageResponse response = MessageResponse.from(saved);
        ConversationRef conversation = saved.getConversation();
        eventPublisher.publishEvent(new MessageCreatedEvent(response, conversation, List.copyOf(recipientIds)));
        metrics.recordMessage(conversation.kind(), saved.getType());
        log.debug("메시지 저장: conversation={}, messageId={}", conversation.roomId(), saved.getId());
        return response;
    }

    private Message requireCursor(Long before, ConversationRef expected) {
        Message cursor = messageRepository.findById(before)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_MESSAGE_CURSOR));
        if (!cursor.getConversation().equals(expected)) {
            throw new BusinessException(ErrorCode.INVALID_MESSAGE_CURSOR);
        }
        return cursor;
    }

    private List<MessageResponse> toChronological(List<Message> newestFirst) {
        List<MessageResponse> result = new ArrayList<>(newestFirst.size());
        for (Message m : newestFirst) {
            result.add(MessageResponse.from(m));
        }
        Collections.reverse(result);
        return result;
    }

    private static String requireBody(String body) {
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.isEmpty()) {
            throw new BusinessException(ErrorCode.EMPTY_MESSAGE_BODY);
        }
        return trimmed;
    }

    private static String normalizeUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return null;
        }
        return imageUrl.trim();
    }
}
