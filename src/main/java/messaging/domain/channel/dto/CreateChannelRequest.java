package messaging.domain.channel.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import messaging.global.enums.ChannelType;

import java.util.List;

@Schema(description = "채널 생성 요청")
public record CreateChannelRequest(
        @NotBlank(message = "channel name required")
        @Size(max = 100)
        String name,
        @NotNull(message = "channel type required")
        ChannelType type,
        @Schema(description = "함께 추가할 멤버 ID 목록 (선택)")
        List<Long> memberIds) {
}
