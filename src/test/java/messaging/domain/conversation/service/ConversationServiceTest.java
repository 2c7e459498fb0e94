package messaging.domain.conversation.service;

import messaging.domain.channel.dto.ChannelResponse;
import messaging.domain.channel.service.ChannelService;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.dm.dto.DmThreadResponse;
import messaging.domain.dm.service.DmThreadService;
import messaging.domain.message.service.MessageService;
import messaging.domain.user.dto.UserSummaryResponse;
import messaging.domain.user.entity.User;
import messaging.domain.user.service.UserService;
import messaging.global.enums.ChannelType;
import messaging.global.enums.ConversationKind;
import messaging.support.ServiceTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationServiceTest extends ServiceTestSupport {

    @Autowired
    private ConversationService conversationService;
    @Autowired
    private ChannelService channelService;
    @Autowired
    private DmThreadService dmThreadService;
    @Autowired
    private MessageService messageService;
    @Autowired
    private UserService userService;

    @Test
    void dmHelloShowsUpForTheRecipient() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        DmThreadResponse thread = dmThreadService.getOrCreateDmThread(alice.getId(), bob.getId());

        messageService.sendDmMessage(thread.id(), alice.getId(), "hello", null);

        List<ConversationSummaryResponse> bobs = conversationService.listConversations(bob.getId());
        assertThat(bobs).hasSize(1);
        ConversationSummaryResponse summary = bobs.get(0);
        assertThat(summary.kind()).isEqualTo(ConversationKind.DM);
        assertThat(summary.id()).isEqualTo(thread.id());
        assertThat(summary.displayName()).isEqualTo("Alice");
        assertThat(summary.otherUserId()).isEqualTo(alice.getId());
        assertThat(summary.lastMessagePreview()).isEqualTo("hello");
        assertThat(summary.lastMessageSenderId()).isEqualTo(alice.getId());
        assertThat(summary.lastMessageAt()).isNotNull();
    }

    @Test
    void conversationsAreOrderedByLatestActivityWithSilentOnesLast() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse quietOld = channelService.createChannel("quiet-old", ChannelType.GENERAL, alice.getId());
        ChannelResponse busy = channelService.createChannel("busy", ChannelType.ACCOUNT_GROUP, alice.getId());
        ChannelResponse quietNew = channelService.createChannel("quiet-new", ChannelType.GENERAL, alice.getId());
        DmThreadResponse dm = dmThreadService.getOrCreateDmThread(alice.getId(), bob.getId());

        messageService.sendChannelMessage(busy.id(), alice.getId(), "first", null);
        messageService.sendDmMessage(dm.id(), bob.getId(), "latest", null);

        List<ConversationSummaryResponse> list = conversationService.listConversations(alice.getId());

        assertThat(list).extracting(ConversationSummaryResponse::displayName)
                .containsExactly("Bob", "busy", "quiet-new", "quiet-old");
        assertThat(list.get(2).lastMessageAt()).isNull();
        assertThat(list.get(1).channelType()).isEqualTo(ChannelType.ACCOUNT_GROUP);
        assertThat(quietOld.id()).isNotEqualTo(quietNew.id());
    }

    @Test
    void systemMessagesCountAsLastMessage() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        ChannelResponse channel = channelService.createChannel("sales-team", ChannelType.GENERAL, alice.getId());

        channelService.addMemberToChannel(channel.id(), bob.getId(), alice.getId());

        ConversationSummaryResponse summary = conversationService.listChannels(bob.getId()).get(0);
        assertThat(summary.lastMessagePreview()).isEqualTo("Alice added Bob to the channel");
        assertThat(summary.lastMessageSenderId()).isEqualTo(alice.getId());
    }

    @Test
    void filteredViewsOnlyContainTheirKind() {
        User alice = createUser("Alice");
        User bob = createUser("Bob");
        channelService.createChannel("sales-team", ChannelType.GENERAL, alice.getId());
        dmThreadService.getOrCreateDmThread(alice.getId(), bob.getId());

        assertThat(conversationService.listChannels(alice.getId()))
                .extracting(ConversationSummaryResponse::kind).containsOnly(ConversationKind.CHANNEL);
        assertThat(conversationService.listDmThreads(alice.getId()))
                .extracting(ConversationSummaryResponse::kind).containsOnly(ConversationKind.DM);
        assertThat(conversationService.listConversations(bob.getId())).hasSize(1);
    }

    @Test
    void previewIsCutAtSixtyCharacters() {
        User alice = createUser("Alice");
        ChannelResponse channel = channelService.createChannel("long", ChannelType.GENERAL, alice.getId());
        String body = "x".repeat(75);

        messageService.sendChannelMessage(channel.id(), alice.getId(), body, null);

        String preview = conversationService.listChannels(alice.getId()).get(0).lastMessagePreview();
        assertThat(preview).hasSize(60).isEqualTo("x".repeat(60));
    }

    @Test
    void previewNeverSplitsASurrogatePair() {
        String emoji = "😀";
        String preview = ConversationService.preview(emoji.repeat(61));

        assertThat(preview.codePointCount(0, preview.length())).isEqualTo(60);
        assertThat(preview).isEqualTo(emoji.repeat(60));
        assertThat(ConversationService.preview("short")).isEqualTo("short");
    }

    @Test
    void userDirectoryExcludesTheCallerAndSortsByName() {
        User zoe = createUser("Zoe");
        createUser("Bob");
        createUser("Alice");

        assertThat(userService.listUsers(zoe.getId()))
                .extracting(UserSummaryResponse::name)
                .containsExactly("Alice", "Bob");
    }
}
