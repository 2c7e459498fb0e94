package messaging.domain.channel.dto;

import messaging.domain.channel.entity.Channel;
import messaging.global.enums.ChannelType;

import java.time.Instant;

public record ChannelResponse(
        Long id,
        String name,
        ChannelType type,
        Long createdById,
        Instant createdAt,
        long memberCount) {

    public static ChannelResponse of(Channel channel, long memberCount) {
        return new ChannelResponse(
                channel.getId(),
                channel.getName(),
                channel.getType(),
                channel.getCreatedBy().getId(),
                channel.getCreatedAt(),
                memberCount
        );
    }
}
