package messaging.domain.message.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.dto.SendMessageRequest;
import messaging.domain.message.service.MessageService;
import messaging.global.config.CustomUserDetails;
import messaging.global.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "메시지 API", description = "채널, DM 메시지 조회 및 전송")
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;

    @Operation(summary = "채널 메시지 조회", description = "before 메시지보다 오래된 메시지를 최대 50개, 오래된 순으로 반환합니다. 멤버가 아니면 빈 목록.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "성공"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "존재하지 않는 채널",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @GetMapping("/channel/{channelId}")
    public ResponseEntity<ApiResponse<List<MessageResponse>>> getChannelMessages(
            @PathVariable Long channelId,
            @Parameter(description = "이 메시지 ID 보다 이전 메시지를 조회") @RequestParam(required = false) Long before,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        List<MessageResponse> messages = messageService.getChannelMessages(channelId, principal.getUserId(), before);
        return ResponseEntity.ok(ApiResponse.success(messages));
    }

    @Operation(summary = "채널 메시지 전송")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "전송됨",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "빈 본문",
                    content = @Content(schema = @Schema(implementation = Object.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "채널 멤버 아님",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PostMapping("/channel/{channelId}")
    public ResponseEntity<ApiResponse<MessageResponse>> sendChannelMessage(
            @PathVariable Long channelId,
            @Valid @RequestBody SendMessageRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        MessageResponse response = messageService.sendChannelMessage(
                channelId, principal.getUserId(), request.body(), request.imageUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @Operation(summary = "DM 메시지 조회", description = "참여자가 아니면 빈 목록.")
    @GetMapping("/dm/{threadId}")
    public ResponseEntity<ApiResponse<List<MessageResponse>>> getDmMessages(
            @PathVariable Long threadId,
            @RequestParam(required = false) Long before,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        List<MessageResponse> messages = messageService.getDmMessages(threadId, principal.getUserId(), before);
        return ResponseEntity.ok(ApiResponse.success(messages));
    }

    @Operation(summary = "DM 메시지 전송")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "전송됨",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "스레드 참여자 아님",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PostMapping("/dm/{threadId}")
    public ResponseEntity<ApiResponse<MessageResponse>> sendDmMessage(
            @PathVariable Long threadId,
            @Valid @RequestBody SendMessageRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        MessageResponse response = messageService.sendDmMessage(
                threadId, principal.getUserId(), request.body(), request.imageUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }
}
