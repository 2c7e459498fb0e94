package messaging.domain.channel.event;

import java.util.List;

public record ChannelRenamedEvent(
        Long channelId,
        String name,
        Long actorId,
        List<Long> memberIds) {
}
