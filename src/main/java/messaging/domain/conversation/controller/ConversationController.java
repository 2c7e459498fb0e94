package messaging.domain.conversation.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.conversation.service.ConversationService;
import messaging.global.config.CustomUserDetails;
import messaging.global.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "대화 목록 API")
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    @Operation(summary = "채널과 DM 을 합친 대화 목록", description = "마지막 메시지 시각 내림차순, 메시지가 없는 대화는 뒤쪽")
    @GetMapping
    public ResponseEntity<ApiResponse<List<ConversationSummaryResponse>>> listConversations(
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(conversationService.listConversations(principal.getUserId())));
    }
}
