package messaging.domain.dm.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.conversation.service.ConversationService;
import messaging.domain.dm.dto.CreateDmThreadRequest;
import messaging.domain.dm.dto.DmThreadResponse;
import messaging.domain.dm.service.DmThreadService;
import messaging.global.config.CustomUserDetails;
import messaging.global.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "DM API", description = "1:1 DM 스레드")
@RestController
@RequestMapping("/api/v1/dm/threads")
@RequiredArgsConstructor
public class DmThreadController {

    private final DmThreadService dmThreadService;
    private final ConversationService conversationService;

    @Operation(summary = "내 DM 스레드 목록")
    @GetMapping
    public ResponseEntity<ApiResponse<List<ConversationSummaryResponse>>> listThreads(
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(conversationService.listDmThreads(principal.getUserId())));
    }

    @Operation(summary = "DM 스레드 열기", description = "상대와의 스레드가 있으면 그대로, 없으면 새로 만들어 반환합니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "성공",
                    content = @Content(schema = @Schema(implementation = DmThreadResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "자기 자신과의 DM",
                    content = @Content(schema = @Schema(implementation = Object.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "존재하지 않는 사용자",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PostMapping
    public ResponseEntity<ApiResponse<DmThreadResponse>> openThread(
            @Valid @RequestBody CreateDmThreadRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        DmThreadResponse response = dmThreadService.getOrCreateDmThread(principal.getUserId(), request.otherUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @Operation(summary = "DM 스레드 조회")
    @GetMapping("/{threadId}")
    public ResponseEntity<ApiResponse<DmThreadResponse>> getThread(
            @PathVariable Long threadId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(dmThreadService.getDmThread(threadId, principal.getUserId())));
    }
}
