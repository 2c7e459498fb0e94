package messaging.domain.conversation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import messaging.global.enums.ChannelType;
import messaging.global.enums.ConversationKind;

import java.time.Instant;

@Schema(description = "대화 목록 항목")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationSummaryResponse(
        ConversationKind kind,
        Long id,
        String displayName,
        Instant lastMessageAt,
        @Schema(description = "마지막 메시지 본문 앞 60자")
        String lastMessagePreview,
        Long lastMessageSenderId,
        Instant createdAt,
        ChannelType channelType,
        Long otherUserId) {
}
