package messaging.domain.message.dto;

import messaging.global.enums.ConversationKind;

/**
 * 대화 목록 갱신용으로 각 멤버의 개인 룸에 보내는 페이로드.
 */
public record ConversationUpdateResponse(
        ConversationKind conversationKind,
        Long conversationId,
        Long senderId,
        MessageResponse message) {
}
