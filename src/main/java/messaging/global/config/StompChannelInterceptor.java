package messaging.global.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import messaging.global.realtime.RoomKeys;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 클라이언트에서 들어오는 STOMP 프레임을 검사한다.
 * <ul>
 *     <li>CONNECT: 핸드셰이크에서 확인한 사용자(또는 CONNECT 의 Authorization 헤더)를 세션 사용자로 등록</li>
 *     <li>SUBSCRIBE: 인증된 세션만, {@link RoomKeys#isSubscribable} 목적지만 허용</li>
 *     <li>SEND: 차단. 메시지 전송은 REST 로만 받는다</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompChannelInterceptor implements ChannelInterceptor {

    public static final String AUTH_ATTRIBUTE = "userAuth";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }
        StompCommand command = accessor.getCommand();
        log.debug("preSend 진입: command={}, destination={}", command, accessor.getDestination());

        if (StompCommand.CONNECT.equals(command)) {
            Authentication auth = authenticate(accessor);
            accessor.setUser(auth);
            Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
            if (sessionAttributes != null) {
                sessionAttributes.put(AUTH_ATTRIBUTE, auth);
            }
            log.info("STOMP 인증 완료: sessionId={}, userId={}", accessor.getSessionId(), auth.getName());
            return message;
        }

        if (StompCommand.SUBSCRIBE.equals(command)) {
            if (sessionAuth(accessor) == null) {
                log.warn("STOMP UNAUTHORIZED: 인증 정보 없는 구독 차단, sessionId={}", accessor.getSessionId());
                return null;
            }
            if (!RoomKeys.isSubscribable(accessor.getDestination())) {
                log.warn("알 수 없는 목적지 구독 차단: sessionId={}, destination={}",
                        accessor.getSessionId(), accessor.getDestination());
                return null;
            }
            return message;
        }

        if (StompCommand.SEND.equals(command)) {
            log.warn("클라이언트 SEND 차단: sessionId={}, destination={}", accessor.getSessionId(), accessor.getDestination());
            return null;
        }

        return message;
    }

    private Authentication authenticate(StompHeaderAccessor accessor) {
        String authHeader = accessor.getFirstNativeHeader("Authorization");
        if (authHeader != null) {
            if (!authHeader.startsWith(BEARER_PREFIX)) {
                log.warn("STOMP CONNECT Authorization 헤더가 Bearer 형식 아님");
                throw new BadCredentialsException("invalid authorization header");
            }
            String token = authHeader.substring(BEARER_PREFIX.length());
            if (!jwtTokenProvider.validateToken(token)) {
                log.warn("STOMP JWT 토큰이 유효하지 않습니다.");
                throw new BadCredentialsException("invalid token");
            }
            return toAuthentication(jwtTokenProvider.getUserIdFromToken(token), jwtTokenProvider.getEmailFromToken(token));
        }

        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        Object userId = sessionAttributes != null
                ? sessionAttributes.get(RealtimeHandshakeInterceptor.USER_ID_ATTRIBUTE)
                : null;
        if (!(userId instanceof Long id)) {
            log.warn("STOMP CONNECT 인증 정보 없음: sessionId={}", accessor.getSessionId());
            throw new BadCredentialsException("authentication required");
        }
        return toAuthentication(id, (String) sessionAttributes.get(RealtimeHandshakeInterceptor.EMAIL_ATTRIBUTE));
    }

    private static Authentication toAuthentication(Long userId, String email) {
        CustomUserDetails principal = new CustomUserDetails(userId, email, List.of());
        return new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
    }

    private static Authentication sessionAuth(StompHeaderAccessor accessor) {
        if (accessor.getUser() instanceof Authentication auth) {
            return auth;
        }
        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        return sessionAttributes != null ? (Authentication) sessionAttributes.get(AUTH_ATTRIBUTE) : null;
    }
}
