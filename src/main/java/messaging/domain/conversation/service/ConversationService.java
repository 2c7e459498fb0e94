package messaging.domain.conversation.service;

import lombok.RequiredArgsConstructor;
import messaging.domain.channel.entity.Channel;
import messaging.domain.channel.entity.ChannelMembership;
import messaging.domain.channel.repository.ChannelMembershipRepository;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.dm.entity.DmThread;
import messaging.domain.dm.repository.DmThreadRepository;
import messaging.domain.message.entity.Message;
import messaging.domain.message.repository.MessageRepository;
import messaging.domain.user.entity.User;
import messaging.global.enums.ConversationKind;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 사용자의 채널, DM 스레드를 하나의 대화 목록으로 합칩니다.
 * 정렬은 마지막 메시지 시각 내림차순이며 메시지가 없는 대화는 뒤로 가고, 그 안에서는 생성 시각 내림차순.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ConversationService {

    static final int PREVIEW_LENGTH = 60;

    private static final Comparator<ConversationSummaryResponse> ORDER =
            Comparator.comparing(ConversationSummaryResponse::lastMessageAt,
                            Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(ConversationSummaryResponse::createdAt,
                            Comparator.nullsLast(Comparator.reverseOrder()));

    private final ChannelMembershipRepository membershipRepository;
    private final DmThreadRepository dmThreadRepository;
    private final MessageRepository messageRepository;

    public List<ConversationSummaryResponse> listConversations(Long userId) {
        List<ConversationSummaryResponse> result = new ArrayList<>();
        result.addAll(channelSummaries(userId));
        result.addAll(dmSummaries(userId));
        result.sort(ORDER);
        return result;
    }

    public List<ConversationSummaryResponse> listChannels(Long userId) {
        List<ConversationSummaryResponse> result = channelSummaries(userId);
        result.sort(ORDER);
        return result;
    }

    public List<ConversationSummaryResponse> listDmThreads(Long userId) {
        List<ConversationSummaryResponse> result = dmSummaries(userId);
        result.sort(ORDER);
        return result;
    }

    private List<ConversationSummaryResponse> channelSummaries(Long userId) {
        List<ConversationSummaryResponse> summaries = new ArrayList<>();
        for (ChannelMembership membership : membershipRepository.findAllWithChannelByUserId(userId)) {
            Channel channel = membership.getChannel();
            Optional<Message> last = messageRepository.findFirstByChannelIdOrderByCreatedAtDescIdDesc(channel.getId());
            summaries.add(new ConversationSummaryResponse(
                    ConversationKind.CHANNEL,
                    channel.getId(),
                    channel.getName(),
                    last.map(Message::getCreatedAt).orElse(null),
                    last.map(m -> preview(m.getBody())).orElse(null),
                    last.map(m -> m.getSender().getId()).orElse(null),
                    channel.getCreatedAt(),
                    channel.getType(),
                    null
            ));
        }
        return summaries;
    }

    private List<ConversationSummaryResponse> dmSummaries(Long userId) {
        List<ConversationSummaryResponse> summaries = new ArrayList<>();
        for (DmThread thread : dmThreadRepository.findAllWithUsersByParticipant(userId)) {
            User other = thread.otherParticipant(userId);
            Optional<Message> last = messageRepository.findFirstByDmThreadIdOrderByCreatedAtDescIdDesc(thread.getId());
            summaries.add(new ConversationSummaryResponse(
                    ConversationKind.DM,
                    thread.getId(),
                    other.getName(),
                    last.map(Message::getCreatedAt).orElse(null),
                    last.map(m -> preview(m.getBody())).orElse(null),
                    last.map(m -> m.getSender().getId()).orElse(null),
                    thread.getCreatedAt(),
                    null,
                    other.getId()
            ));
        }
        return summaries;
    }

    // 서로게이트 쌍이 잘리지 않도록 코드 포인트 기준
    static String preview(String body) {
        if (body == null) {
            return null;
        }
        if (body.codePointCount(0, body.length()) <= PREVIEW_LENGTH) {
            return body;
        }
        return body.substring(0, body.offsetByCodePoints(0, PREVIEW_LENGTH));
    }
}
