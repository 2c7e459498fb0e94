package messaging.global.realtime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.domain.channel.dto.ChannelRenamedResponse;
import messaging.domain.channel.event.ChannelRenamedEvent;
import messaging.domain.message.dto.ConversationUpdateResponse;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.event.MessageCreatedEvent;
import messaging.global.enums.RealtimeEventType;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋된 변경만 실시간으로 내보낸다. 롤백된 전송은 이벤트가 전달되지 않는다.
 * <p>
 * 커밋한 스레드에서 바로 브로커로 넘긴다. 소켓 쓰기는 clientOutboundChannel 이 세션별 순서를 유지하며 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeFanoutListener {

    private final RealtimeHub hub;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onMessageCreated(MessageCreatedEvent event) {
        MessageResponse message = event.message();
        hub.publishToRoom(event.conversation().roomId(), RealtimeEventType.new_message, message);

        ConversationUpdateResponse update = new ConversationUpdateResponse(
                event.conversation().kind(),
                event.conversation().id(),
                message.senderId(),
                message
        );
        for (Long recipientId : event.recipientIds()) {
            hub.publishToUser(recipientId, RealtimeEventType.conversation_update, update);
        }
        log.debug("메시지 팬아웃: room={}, messageId={}, recipients={}",
                event.conversation().roomId(), message.id(), event.recipientIds().size());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onChannelRenamed(ChannelRenamedEvent event) {
        ChannelRenamedResponse payload = new ChannelRenamedResponse(event.channelId(), event.name(), event.actorId());
        hub.publishToRoom(RoomKeys.channel(event.channelId()), RealtimeEventType.channel_renamed, payload);
        for (Long memberId : event.memberIds()) {
            hub.publishToUser(memberId, RealtimeEventType.channel_renamed, payload);
        }
    }
}
