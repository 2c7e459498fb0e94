package messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import messaging.domain.channel.dto.ChannelResponse;
import messaging.domain.channel.service.ChannelService;
import messaging.domain.conversation.dto.ConversationSummaryResponse;
import messaging.domain.conversation.service.ConversationService;
import messaging.domain.dm.dto.DmThreadResponse;
import messaging.domain.dm.service.DmThreadService;
import messaging.domain.message.dto.MessageResponse;
import messaging.domain.message.service.MessageService;
import messaging.domain.user.entity.User;
import messaging.domain.user.repository.UserRepository;
import messaging.global.config.JwtTokenProvider;
import messaging.global.enums.ChannelType;
import messaging.global.enums.UserRole;
import messaging.global.realtime.RealtimeEnvelope;
import messaging.global.realtime.RoomKeys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 실제 포트에 STOMP 클라이언트로 붙어 저장, 커밋 후 팬아웃, 대화 목록까지 이어지는 흐름을 확인한다.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
class MessagingScenarioTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String READY_EVENT = "ready";

    @LocalServerPort
    private int port;

    @Autowired
    private UserRepository userRepository;
    @Autowired
    private ChannelService channelService;
    @Autowired
    private DmThreadService dmThreadService;
    @Autowired
    private MessageService messageService;
    @Autowired
    private ConversationService conversationService;
    @Autowired
    private SimpMessageSendingOperations messagingTemplate;
    @Autowired
    private JwtTokenProvider jwtTokenProvider;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private MockMvc mockMvc;

    private WebSocketStompClient stompClient;
    private final List<StompSession> sessions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        stompClient = new WebSocketStompClient(new StandardWebSocketClient());
    }

    @AfterEach
    void tearDown() {
        sessions.stream().filter(StompSession::isConnected).forEach(StompSession::disconnect);
        stompClient.stop();
    }

    @Test
    void addedMemberGetsConversationUpdateWithoutSubscribingToTheChannel() throws Exception {
        User alice = user("Alice");
        User bob = user("Bob");
        Inbox bobEvents = subscribeToOwnEvents(connect(bob), bob);

        ChannelResponse channel = channelService.createChannel("sales-team", ChannelType.GENERAL, alice.getId());
        MessageResponse system = channelService.addMemberToChannel(channel.id(), bob.getId(), alice.getId());

        assertThat(system.body()).isEqualTo("Alice added Bob to the channel");
        JsonNode data = bobEvents.take("conversation_update", 1).get(0).path("data");
        assertThat(data.path("conversationKind").asText()).isEqualTo("channel");
        assertThat(data.path("conversationId").asLong()).isEqualTo(channel.id());
        assertThat(data.path("message").path("body").asText()).isEqualTo("Alice added Bob to the channel");

        assertThat(messageService.getChannelMessages(channel.id(), alice.getId(), null))
                .extracting(MessageResponse::body)
                .containsExactly("Alice added Bob to the channel");
        assertThat(messageService.getChannelMessages(channel.id(), bob.getId(), null))
                .extracting(MessageResponse::id)
                .containsExactly(system.id());
    }

    @Test
    void dmHelloReachesSubscribedSocketAndConversationList() throws Exception {
        User alice = user("Alice");
        User bob = user("Bob");
        DmThreadResponse thread = dmThreadService.getOrCreateDmThread(alice.getId(), bob.getId());
        StompSession bobSession = connect(bob);
        Inbox bobEvents = subscribeToOwnEvents(bobSession, bob);
        Inbox dmRoom = subscribeToRoom(bobSession, RoomKeys.dmThread(thread.id()));

        messageService.sendDmMessage(thread.id(), alice.getId(), "hello", null);

        JsonNode frame = dmRoom.take("new_message", 1).get(0);
        assertThat(frame.path("data").path("body").asText()).isEqualTo("hello");
        assertThat(frame.path("data").path("senderName").asText()).isEqualTo("Alice");
        bobEvents.take("conversation_update", 1);

        ConversationSummaryResponse top = conversationService.listConversations(bob.getId()).get(0);
        assertThat(top.displayName()).isEqualTo("Alice");
        assertThat(top.lastMessagePreview()).isEqualTo("hello");
        assertThat(top.lastMessageSenderId()).isEqualTo(alice.getId());
    }

    @Test
    void consecutiveSendsReachTheRoomInStoreOrder() throws Exception {
        User alice = user("Alice");
        User bob = user("Bob");
        ChannelResponse channel = channelService.createChannel("pipeline", ChannelType.GENERAL, alice.getId());
        channelService.addMemberToChannel(channel.id(), bob.getId(), alice.getId());
        StompSession bobSession = connect(bob);
        Inbox room = subscribeToRoom(bobSession, RoomKeys.channel(channel.id()));
        Inbox bobEvents = subscribeToOwnEvents(bobSession, bob);

        List<Long> sentIds = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            sentIds.add(messageService.sendChannelMessage(channel.id(), alice.getId(), "m" + i, null).id());
        }

        List<Long> roomIds = room.take("new_message", 300).stream()
                .map(frame -> frame.path("data").path("id").asLong())
                .toList();
        List<Long> updateIds = bobEvents.take("conversation_update", 300).stream()
                .map(frame -> frame.path("data").path("message").path("id").asLong())
                .toList();
        assertThat(roomIds).containsExactlyElementsOf(sentIds);
        assertThat(updateIds).containsExactlyElementsOf(sentIds);
    }

    @Test
    void handshakeWithoutTokenIsRefused() {
        assertThatThrownBy(() -> stompClient
                .connectAsync("ws://localhost:{port}/ws", new StompSessionHandlerAdapter() {
                }, port)
                .get(TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class);
    }

    @Test
    void restApiRequiresAValidBearerToken() throws Exception {
        User alice = user("Alice");

        mockMvc.perform(get("/api/v1/conversations"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/api/v1/conversations")
                        .header("Authorization", "Bearer " + jwtTokenProvider.createAccessToken(alice.getId(), alice.getEmail())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isArray());
    }

    private User user(String name) {
        String email = name.toLowerCase() + "+" + UUID.randomUUID() + "@example.com";
        return userRepository.save(new User(name, email, UserRole.REP));
    }

    private StompSession connect(User user) throws Exception {
        String token = jwtTokenProvider.createAccessToken(user.getId(), user.getEmail());
        StompSession session = stompClient
                .connectAsync("ws://localhost:{port}/ws?token={token}", new StompSessionHandlerAdapter() {
                }, port, token)
                .get(TIMEOUT.toSeconds(), TimeUnit.SECONDS);
        sessions.add(session);
        return session;
    }

    private Inbox subscribeToRoom(StompSession session, String destination) throws InterruptedException {
        Inbox inbox = new Inbox();
        session.subscribe(destination, inbox);
        inbox.awaitReady(() -> messagingTemplate.convertAndSend(destination, new RealtimeEnvelope(READY_EVENT, null)));
        return inbox;
    }

    private Inbox subscribeToOwnEvents(StompSession session, User user) throws InterruptedException {
        Inbox inbox = new Inbox();
        session.subscribe(RoomKeys.USER_EVENTS_SUBSCRIPTION, inbox);
        inbox.awaitReady(() -> messagingTemplate.convertAndSendToUser(String.valueOf(user.getId()),
                RoomKeys.USER_EVENTS, new RealtimeEnvelope(READY_EVENT, null)));
        return inbox;
    }

    /**
     * 한 구독으로 들어온 프레임. 구독 등록은 비동기이므로 ready 프레임이 돌아올 때까지 기다린 뒤 사용한다.
     */
    private final class Inbox implements StompFrameHandler {

        private final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return byte[].class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            try {
                frames.add(objectMapper.readTree((byte[]) payload));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        void awaitReady(Runnable sendReady) throws InterruptedException {
            long deadline = System.nanoTime() + TIMEOUT.toNanos();
            while (System.nanoTime() < deadline) {
                sendReady.run();
                JsonNode frame = frames.poll(100, TimeUnit.MILLISECONDS);
                if (frame != null && READY_EVENT.equals(frame.path("event").asText())) {
                    return;
                }
            }
            throw new AssertionError("subscription was not registered in time");
        }

        List<JsonNode> take(String event, int count) throws InterruptedException {
            List<JsonNode> matched = new ArrayList<>();
            long deadline = System.nanoTime() + TIMEOUT.toNanos();
            while (matched.size() < count) {
                long remaining = deadline - System.nanoTime();
                JsonNode frame = remaining > 0 ? frames.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (frame == null) {
                    throw new AssertionError("timed out waiting for " + count + " '" + event
                            + "' frame(s), got " + matched.size());
                }
                if (event.equals(frame.path("event").asText())) {
                    matched.add(frame);
                }
            }
            return matched;
        }
    }
}
