package messaging.domain.channel.service;

import messaging.domain.channel.dto.ChannelMemberResponse;
import messaging.domain.channel.dto.ChannelResponse;
import messaging.domain.channel.event.ChannelRenamedEvent;
import messaging.domain.channel.repository.ChannelMembershipRepository;
import messaging.domain.channel.repository.ChannelRepository;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.event.MessageCreatedEvent;
import messaging.domain.message.service.MessageService;
import messaging.domain.user.entity.User;
import messaging.global.enums.ChannelType;
import messaging.global.enums.ErrorCode;
import messaging.global.enums.MembershipRole;
import messaging.global.enums.MessageType;
import messaging.support.ServiceTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@RecordApplicationEvents
class ChannelServiceTest extends ServiceTestSupport {

    @Autowired
    private ChannelService channelService;
    @Autowired
    private MembershipAuthority authority;
    @Autowired
    private MessageService messageService;
    @Autowired
    private ChannelRepository channelRepository;
    @Autowired
    private ChannelMembershipRepository membershipRepository;
    @Autowired
    private ApplicationEvents events;

    @Test
    void creatorIsTheSoleAdmin() {
        User alice = createUser("Alice");

        ChannelResponse channel = channelService.createChannel("  sales-team  ", ChannelType.GENERAL, alice.getId());

        assertThat(channel.name()).isEqualTo("sales-team");
        assertThat(channel.memberCount()).isEqualTo(1);
        assertThat(authority.isChannelAdmin(channel.id(), alice.getId())).isTrue();
        assertThat(membershipRepository.countByChannelIdAndRole(channel.id(), MembershipRole.ADMIN)).isEqualTo(1);
        assertThat(membershipRepository.countByChannelId(channel.id())).isEqualTo(1);
    }

    @Test
    void initialMembersJoinAsMembersAndCreatorIsNotDuplicated() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        User carol = createUser("Carol");

        ChannelResponse channel = channelService.createChannel("producers", ChannelType.PRODUCER_GROUP,
                alice.getId(), List.of(bob.getId(), carol.getId(), alice.getId()));

        assertThat(channel.memberCount()).isEqualTo(3);
        assertThat(membershipRepository.countByChannelIdAndRole(channel.id(), MembershipRole.ADMIN)).isEqualTo(1);
        assertThat(authority.isChannelAdmin(channel.id(), bob.getId())).isFalse();
        assertThat(authority.isChannelMember(channel.id(), carol.getId())).isTrue();
    }

    @Test
    void blankNameIsRejected() {
        User alice = createUser("Alice");

        assertBusinessError(() -> channelService.createChannel("   ", ChannelType.GENERAL, alice.getId()),
                ErrorCode.INVALID_CHANNEL_NAME);
    }

    @Test
    void unknownInitialMemberFailsCreation() {
        User alice = createUser("Alice");

        assertBusinessError(() -> channelService.createChannel("x", ChannelType.GENERAL, alice.getId(), List.of(999_999L)),
                ErrorCode.USER_NOT_FOUND);
    }

    @Test
    void addingMemberWritesSystemMessageAndNotifiesNewMember() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales-team", ChannelType.GENERAL, alice.getId());

        MessageResponse system = channelService.addMemberToChannel(channel.id(), bob.getId(), alice.getId());

        assertThat(system.type()).isEqualTo(MessageType.SYSTEM);
        assertThat(system.body()).isEqualTo("Alice added Bob to the channel");
        assertThat(system.channelId()).isEqualTo(channel.id());
        assertThat(authority.isChannelMember(channel.id(), bob.getId())).isTrue();
        assertThat(messageService.getChannelMessages(channel.id(), alice.getId(), null))
                .extracting(MessageResponse::body)
                .containsExactly("Alice added Bob to the channel");
        assertThat(messageService.getChannelMessages(channel.id(), bob.getId(), null))
                .extracting(MessageResponse::id)
                .containsExactly(system.id());

        List<MessageCreatedEvent> published = events.stream(MessageCreatedEvent.class).toList();
        assertThat(published).hasSize(1);
        assertThat(published.get(0).recipientIds()).containsExactlyInAnyOrder(alice.getId(), bob.getId());
    }

    @Test
    void anyMemberMayAddButNotOutsiders() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        User carol = createUser("Carol");
        User dave = createUser("Dave");
        ChannelResponse channel = channelService.createChannel("accounts", ChannelType.ACCOUNT_GROUP,
                alice.getId(), List.of(bob.getId()));

        assertBusinessError(() -> channelService.addMemberToChannel(channel.id(), dave.getId(), carol.getId()),
                ErrorCode.NOT_CHANNEL_MEMBER);

        MessageResponse system = channelService.addMemberToChannel(channel.id(), carol.getId(), bob.getId());
        assertThat(system.body()).isEqualTo("Bob added Carol to the channel");
    }

    @Test
    void addingExistingMemberIsRejected() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales", ChannelType.GENERAL,
                alice.getId(), List.of(bob.getId()));

        assertBusinessError(() -> channelService.addMemberToChannel(channel.id(), bob.getId(), alice.getId()),
                ErrorCode.ALREADY_CHANNEL_MEMBER);
        assertThat(events.stream(MessageCreatedEvent.class)).isEmpty();
    }

    @Test
    void renameByNonAdminIsRejectedAndNameUnchanged() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales-team", ChannelType.GENERAL,
                alice.getId(), List.of(bob.getId()));

        assertBusinessError(() -> channelService.renameChannel(channel.id(), "hijacked", bob.getId()),
                ErrorCode.NOT_CHANNEL_ADMIN);

        assertThat(channelRepository.findById(channel.id()).orElseThrow().getName()).isEqualTo("sales-team");
        assertThat(events.stream(ChannelRenamedEvent.class)).isEmpty();
        assertThat(events.stream(MessageCreatedEvent.class)).isEmpty();
    }

    @Test
    void renameByAdminUpdatesNameAndAnnounces() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales-team", ChannelType.GENERAL,
                alice.getId(), List.of(bob.getId()));

        ChannelResponse renamed = channelService.renameChannel(channel.id(), " east-coast ", alice.getId());

        assertThat(renamed.name()).isEqualTo("east-coast");
        assertThat(channelRepository.findById(channel.id()).orElseThrow().getName()).isEqualTo("east-coast");

        MessageCreatedEvent system = events.stream(MessageCreatedEvent.class).findFirst().orElseThrow();
        assertThat(system.message().body()).isEqualTo("Alice renamed the channel to \"east-coast\"");

        ChannelRenamedEvent event = events.stream(ChannelRenamedEvent.class).findFirst().orElseThrow();
        assertThat(event.name()).isEqualTo("east-coast");
        assertThat(event.memberIds()).containsExactlyInAnyOrder(alice.getId(), bob.getId());
    }

    @Test
    void renameOfMissingChannelIsNotFound() {
        User alice = createUser("Alice");

        assertBusinessError(() -> channelService.renameChannel(999_999L, "nope", alice.getId()),
                ErrorCode.CHANNEL_NOT_FOUND);
    }

    @Test
    void removeGuardsAreCheckedInOrder() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        User carol = createUser("Carol");
        ChannelResponse channel = channelService.createChannel("sales", ChannelType.GENERAL,
                alice.getId(), List.of(bob.getId()));

        assertBusinessError(() -> channelService.removeMemberFromChannel(channel.id(), alice.getId(), alice.getId()),
                ErrorCode.CANNOT_REMOVE_SELF);
        assertBusinessError(() -> channelService.removeMemberFromChannel(channel.id(), alice.getId(), bob.getId()),
                ErrorCode.NOT_CHANNEL_ADMIN);
        assertBusinessError(() -> channelService.removeMemberFromChannel(channel.id(), carol.getId(), alice.getId()),
                ErrorCode.CHANNEL_MEMBER_NOT_FOUND);
        assertBusinessError(() -> channelService.removeMemberFromChannel(999_999L, bob.getId(), alice.getId()),
                ErrorCode.CHANNEL_NOT_FOUND);
    }

    @Test
    void removedMemberLosesAccessAndStillGetsTheUpdate() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales", ChannelType.GENERAL,
                alice.getId(), List.of(bob.getId()));

        MessageResponse system = channelService.removeMemberFromChannel(channel.id(), bob.getId(), alice.getId());

        assertThat(system.body()).isEqualTo("Alice removed Bob from the channel");
        assertThat(authority.isChannelMember(channel.id(), bob.getId())).isFalse();
        MessageCreatedEvent event = events.stream(MessageCreatedEvent.class).findFirst().orElseThrow();
        assertThat(event.recipientIds()).containsExactlyInAnyOrder(alice.getId(), bob.getId());
    }

    @Test
    void channelDetailsAreHiddenFromNonMembers() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales", ChannelType.GENERAL, alice.getId());

        assertBusinessError(() -> channelService.getChannel(channel.id(), bob.getId()), ErrorCode.CHANNEL_NOT_FOUND);
        assertThat(channelService.getChannelMembers(channel.id(), bob.getId())).isEmpty();

        List<ChannelMemberResponse> members = channelService.getChannelMembers(channel.id(), alice.getId());
        assertThat(members).extracting(ChannelMemberResponse::userId).containsExactly(alice.getId());
        assertThat(members.get(0).role()).isEqualTo(MembershipRole.ADMIN);
    }
}
