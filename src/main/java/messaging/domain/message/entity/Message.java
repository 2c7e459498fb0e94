package messaging.domain.message.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import messaging.domain.channel.entity.Channel;
import messaging.domain.dm.entity.DmThread;
import messaging.domain.user.entity.User;
import messaging.global.enums.MessageType;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Table(
        name = "messages",
        indexes = {
                @Index(name = "idx_messages_channel_created", columnList = "channel_id, created_at"),
                @Index(name = "idx_messages_dm_thread_created", columnList = "dm_thread_id, created_at")
        }
)
@Check(
        name = "ck_messages_single_conversation",
        constraints = "(channel_id IS NOT NULL AND dm_thread_id IS NULL) "
                + "OR (channel_id IS NULL AND dm_thread_id IS NOT NULL)"
)
@Getter
@NoArgsConstructor
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "message_id")
    private Long id;

    @Getter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id")
    private Channel channel;

    @Getter(AccessLevel.NONE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "dm_thread_id")
    private DmThread dmThread;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sender_id", nullable = false)
    private User sender;

    @Column(name = "body", columnDefinition = "TEXT", nullable = false)
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false)
    private MessageType type;

    @Column(name = "image_url")
    private String imageUrl;

    // 커서 비교가 DB 왕복 후에도 같도록 마이크로초로 자른다
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Message(Channel channel, DmThread dmThread, User sender, String body,
                    MessageType type, String imageUrl) {
        this.channel = channel;
        this.dmThread = dmThread;
        this.sender = sender;
        this.body = body;
        this.type = type;
        this.imageUrl = imageUrl;
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public static Message inChannel(Channel channel, User sender, String body, String imageUrl) {
        return new Message(channel, null, sender, body, MessageType.MESSAGE, imageUrl);
    }

    public static Message inDmThread(DmThread dmThread, User sender, String body, String imageUrl) {
        return new Message(null, dmThread, sender, body, MessageType.MESSAGE, imageUrl);
    }

    public static Message system(Channel channel, User actor, String text) {
        return new Message(channel, null, actor, text, MessageType.SYSTEM, null);
    }

    public ConversationRef getConversation() {
        if (channel != null) {
            return new ConversationRef.ChannelRef(channel.getId());
        }
        return new ConversationRef.DmThreadRef(dmThread.getId());
    }
}
