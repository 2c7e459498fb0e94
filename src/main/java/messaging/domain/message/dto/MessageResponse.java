package messaging.domain.message.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import messaging.domain.message.entity.ConversationRef;
import messaging.domain.message.entity.Message;
import messaging.domain.user.entity.User;
import messaging.global.enums.ConversationKind;
import messaging.global.enums.MessageType;

import java.time.Instant;

@Schema(description = "저장된 메시지")
public record MessageResponse(
        Long id,
        ConversationKind conversationKind,
        Long channelId,
        Long dmThreadId,
        Long senderId,
        String senderName,
        String senderEmail,
        String body,
        MessageType type,
        String imageUrl,
        Instant createdAt) {

    public static MessageResponse from(Message message) {
        ConversationRef conversation = message.getConversation();
        User sender = message.getSender();
        Long channelId = conversation instanceof ConversationRef.ChannelRef c ? c.id() : null;
        Long dmThreadId = conversation instanceof ConversationRef.DmThreadRef d ? d.id() : null;
        return new MessageResponse(
                message.getId(),
                conversation.kind(),
                channelId,
                dmThreadId,
                sender.getId(),
                sender.getName(),
                sender.getEmail(),
                message.getBody(),
                message.getType(),
                message.getImageUrl(),
                message.getCreatedAt()
        );
    }
}
