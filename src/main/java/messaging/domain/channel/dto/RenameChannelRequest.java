package messaging.domain.channel.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameChannelRequest(
        @NotBlank(message = "channel name required")
        @Size(max = 100)
        String name) {
}
