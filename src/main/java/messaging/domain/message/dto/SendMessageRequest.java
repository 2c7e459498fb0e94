package messaging.domain.message.dto;

import jakarta.validation.constraints.Size;

public record SendMessageRequest(
        @Size(max = 10000, message = "message body is too long")
        String body,
        @Size(max = 2048)
        String imageUrl) {
}
