package messaging.domain.dm.dto;

import jakarta.validation.constraints.NotNull;

public record CreateDmThreadRequest(
        @NotNull(message = "otherUserId required")
        Long otherUserId) {
}
