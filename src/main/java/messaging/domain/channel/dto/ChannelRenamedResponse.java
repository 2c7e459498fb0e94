package messaging.domain.channel.dto;

public record ChannelRenamedResponse(
        Long channelId,
        String name,
        Long actorId) {
}
