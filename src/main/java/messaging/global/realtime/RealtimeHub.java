package messaging.global.realtime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.global.enums.RealtimeEventType;
import messaging.global.metrics.MessagingMetrics;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;
import org.springframework.web.socket.messaging.SessionUnsubscribeEvent;

import java.security.Principal;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실시간 이벤트의 진입점. 구독 관리와 세션별 전달은 STOMP simple broker 가 맡고,
 * 여기서는 목적지 규칙({@link RoomKeys})과 봉투 형식을 고정한다.
 * <p>
 * 전달은 최선 노력, 최대 한 번이다. 브로커로 넘기다 실패하면 로그와 메트릭만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeHub {

    private final SimpMessageSendingOperations messagingTemplate;
    private final MessagingMetrics metrics;

    // SessionDisconnectEvent 는 한 세션에 여러 번 올 수 있다
    private final Set<String> sessions = ConcurrentHashMap.newKeySet();

    @EventListener
    public void onConnect(SessionConnectedEvent event) {
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (sessionId == null || !sessions.add(sessionId)) {
            return;
        }
        metrics.connectionOpened();
        log.info("실시간 연결: sessionId={}, userId={}", sessionId, userName(event.getUser()));
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        if (!sessions.remove(event.getSessionId())) {
            return;
        }
        metrics.connectionClosed();
        log.info("실시간 연결 종료: sessionId={}, userId={}, status={}",
                event.getSessionId(), userName(event.getUser()), event.getCloseStatus());
    }

    @EventListener
    public void joinRoom(SessionSubscribeEvent event) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.wrap(event.getMessage());
        log.debug("룸 참가: sessionId={}, destination={}", accessor.getSessionId(), accessor.getDestination());
    }

    @EventListener
    public void leaveRoom(SessionUnsubscribeEvent event) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.wrap(event.getMessage());
        log.debug("룸 퇴장: sessionId={}, subscriptionId={}", accessor.getSessionId(), accessor.getSubscriptionId());
    }

    public void publishToRoom(String destination, RealtimeEventType event, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, new RealtimeEnvelope(event.name(), payload));
        } catch (MessagingException e) {
            metrics.recordDeliveryFailure();
            log.warn("실시간 전송 실패: destination={}, event={}, reason={}", destination, event, e.getMessage());
        }
    }

    public void publishToUser(Long userId, RealtimeEventType event, Object payload) {
        try {
            messagingTemplate.convertAndSendToUser(String.valueOf(userId), RoomKeys.USER_EVENTS,
                    new RealtimeEnvelope(event.name(), payload));
        } catch (MessagingException e) {
            metrics.recordDeliveryFailure();
            log.warn("실시간 전송 실패: userId={}, event={}, reason={}", userId, event, e.getMessage());
        }
    }

    public int connectionCount() {
        return sessions.size();
    }

    private static String userName(Principal user) {
        return user != null ? user.getName() : null;
    }
}
