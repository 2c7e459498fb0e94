package messaging.domain.channel.dto;

import messaging.domain.channel.entity.ChannelMembership;
import messaging.domain.user.entity.User;
import messaging.global.enums.MembershipRole;
import messaging.global.enums.UserRole;

import java.time.Instant;

public record ChannelMemberResponse(
        Long userId,
        String name,
        String email,
        UserRole userRole,
        MembershipRole role,
        Instant joinedAt) {

    public static ChannelMemberResponse from(ChannelMembership membership) {
        User user = membership.getUser();
        return new ChannelMemberResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole(),
                membership.getRole(),
                membership.getJoinedAt()
        );
    }
}
