package messaging.domain.channel.dto;

import jakarta.validation.constraints.NotNull;

public record AddMemberRequest(
        @NotNull(message = "userId required")
        Long userId) {
}
