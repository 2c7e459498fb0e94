package messaging.domain.channel.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import messaging.domain.user.entity.User;
import messaging.global.enums.MembershipRole;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Table(
        name = "channel_memberships",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_channel_membership_channel_user",
                columnNames = {"channel_id", "user_id"}
        )
)
@Getter
@NoArgsConstructor
public class ChannelMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "membership_id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    private Channel channel;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false)
    private MembershipRole role;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    private ChannelMembership(Channel channel, User user, MembershipRole role) {
        this.channel = channel;
        this.user = user;
        this.role = role;
        this.joinedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public static ChannelMembership admin(Channel channel, User user) {
        return new ChannelMembership(channel, user, MembershipRole.ADMIN);
    }

    public static ChannelMembership member(Channel channel, User user) {
        return new ChannelMembership(channel, user, MembershipRole.MEMBER);
    }
}
