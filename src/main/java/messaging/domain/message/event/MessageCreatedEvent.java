package messaging.domain.message.event;

import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.entity.ConversationRef;

import java.util.List;

/**
 * 메시지가 저장된 뒤 발행된다. recipientIds 는 conversation_update 를 받을 사용자 목록.
 */
public record MessageCreatedEvent(
        MessageResponse message,
        ConversationRef conversation,
        List<Long> recipientIds) {
}
