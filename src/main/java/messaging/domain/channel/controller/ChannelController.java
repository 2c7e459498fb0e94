package messaging.domain.channel.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import messaging.domain.channel.dto.AddMemberRequest;
import messaging.domain.channel.dto.ChannelMemberResponse;
import messaging.domain.channel.dto.ChannelResponse;
import messaging.domain.channel.dto.CreateChannelRequest;
import messaging.domain.channel.dto.RenameChannelRequest;
import messaging.domain.channel.service.ChannelService;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.conversation.service.ConversationService;
import messaging.domain.message.dto.MessageResponse;
import messaging.global.config.CustomUserDetails;
import messaging.global.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "채널 API", description = "채널 생성, 이름 변경, 멤버 관리")
@RestController
@RequestMapping("/api/v1/channels")
@RequiredArgsConstructor
public class ChannelController {

    private final ChannelService channelService;
    private final ConversationService conversationService;

    @Operation(summary = "내 채널 목록", description = "마지막 메시지 시각 내림차순")
    @GetMapping
    public ResponseEntity<ApiResponse<List<ConversationSummaryResponse>>> listChannels(
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(conversationService.listChannels(principal.getUserId())));
    }

    @Operation(summary = "채널 생성", description = "생성자는 관리자로 등록됩니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "생성됨",
                    content = @Content(schema = @Schema(implementation = ChannelResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "이름 누락",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PostMapping
    public ResponseEntity<ApiResponse<ChannelResponse>> createChannel(
            @Valid @RequestBody CreateChannelRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        ChannelResponse response = channelService.createChannel(
                request.name(), request.type(), principal.getUserId(), request.memberIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @Operation(summary = "채널 조회")
    @GetMapping("/{channelId}")
    public ResponseEntity<ApiResponse<ChannelResponse>> getChannel(
            @PathVariable Long channelId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(channelService.getChannel(channelId, principal.getUserId())));
    }

    @Operation(summary = "채널 이름 변경", description = "채널 관리자만 가능합니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "성공"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "403", description = "관리자 아님",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PatchMapping("/{channelId}")
    public ResponseEntity<ApiResponse<ChannelResponse>> renameChannel(
            @PathVariable Long channelId,
            @Valid @RequestBody RenameChannelRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        ChannelResponse response = channelService.renameChannel(channelId, request.name(), principal.getUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @Operation(summary = "채널 멤버 목록", description = "멤버가 아니면 빈 목록")
    @GetMapping("/{channelId}/members")
    public ResponseEntity<ApiResponse<List<ChannelMemberResponse>>> getMembers(
            @PathVariable Long channelId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(channelService.getChannelMembers(channelId, principal.getUserId())));
    }

    @Operation(summary = "채널 멤버 추가", description = "채널 멤버라면 누구나 추가할 수 있습니다. 생성된 시스템 메시지를 반환합니다.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "추가됨",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "이미 멤버",
                    content = @Content(schema = @Schema(implementation = Object.class)))
    })
    @PostMapping("/{channelId}/members")
    public ResponseEntity<ApiResponse<MessageResponse>> addMember(
            @PathVariable Long channelId,
            @Valid @RequestBody AddMemberRequest request,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        MessageResponse response = channelService.addMemberToChannel(channelId, request.userId(), principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response));
    }

    @Operation(summary = "채널 멤버 제거", description = "관리자만 가능하며 자기 자신은 제거할 수 없습니다.")
    @DeleteMapping("/{channelId}/members/{userId}")
    public ResponseEntity<ApiResponse<MessageResponse>> removeMember(
            @PathVariable Long channelId,
            @PathVariable Long userId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        MessageResponse response = channelService.removeMemberFromChannel(channelId, userId, principal.getUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
