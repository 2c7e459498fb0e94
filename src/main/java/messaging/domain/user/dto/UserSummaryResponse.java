package messaging.domain.user.dto;

import messaging.domain.user.entity.User;
import messaging.global.enums.UserRole;

public record UserSummaryResponse(
        Long id,
        String name,
        String email,
        UserRole role) {

    public static UserSummaryResponse from(User user) {
        return new UserSummaryResponse(user.getId(), user.getName(), user.getEmail(), user.getRole());
    }
}
