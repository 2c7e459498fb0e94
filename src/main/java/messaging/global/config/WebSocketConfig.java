package messaging.global.config;

import lombok.RequiredArgsConstructor;
import messaging.global.realtime.RoomKeys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final RealtimeHandshakeInterceptor realtimeHandshakeInterceptor;
    private final StompChannelInterceptor stompChannelInterceptor;

    @Value("${app.realtime.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${app.realtime.send-time-limit-ms:10000}")
    private int sendTimeLimitMs;

    @Value("${app.realtime.send-buffer-size:524288}")
    private int sendBufferSize;

    @Value("${app.realtime.outbound.core-pool-size:10}")
    private int outboundCorePoolSize;

    @Value("${app.realtime.outbound.max-pool-size:50}")
    private int outboundMaxPoolSize;

    @Value("${app.realtime.outbound.queue-capacity:1000}")
    private int outboundQueueCapacity;

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .addInterceptors(realtimeHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker(RoomKeys.TOPIC_PREFIX, RoomKeys.QUEUE_PREFIX);
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix(RoomKeys.USER_PREFIX);
        // 한 세션에 대한 전송 순서를 발행 순서와 같게 유지
        registry.setPreservePublishOrder(true);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(stompChannelInterceptor);
    }

    @Override
    public void configureClientOutboundChannel(ChannelRegistration registration) {
        registration.taskExecutor()
                .corePoolSize(outboundCorePoolSize)
                .maxPoolSize(outboundMaxPoolSize)
                .queueCapacity(outboundQueueCapacity);
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendTimeLimit(sendTimeLimitMs)
                .setSendBufferSizeLimit(sendBufferSize);
    }
}
