package messaging.global.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import messaging.global.enums.ChannelType;
import messaging.global.enums.ConversationKind;
import messaging.global.enums.MessageType;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MessagingMetrics {

    private final MeterRegistry registry;
    private final Counter dmThreadCreateCount;
    private final Counter realtimeDeliveryFailureCount;
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    public MessagingMetrics(MeterRegistry registry) {
        this.registry = registry;
        dmThreadCreateCount = Counter.builder("feature_dm_thread_create_total")
                .description("DM 스레드 생성 누계").register(registry);
        realtimeDeliveryFailureCount = Counter.builder("realtime_delivery_failure_total")
                .description("실시간 전송 실패 누계").register(registry);

        Gauge.builder("realtime_connections_active", activeConnections, AtomicInteger::get)
                .description("현재 연결된 실시간 소켓 수").register(registry);
    }

    public void recordMessage(ConversationKind kind, MessageType type) {
        registry.counter("feature_message_total",
                Tags.of("kind", kind.getValue(), "type", type.name().toLowerCase())).increment();
    }

    public void recordChannelCreated(ChannelType type) {
        registry.counter("feature_channel_create_total",
                Tags.of("type", type.name().toLowerCase())).increment();
    }

    public void recordDmThreadCreated() {
        dmThreadCreateCount.increment();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void recordDeliveryFailure() {
        realtimeDeliveryFailureCount.increment();
    }

    public int activeConnections() {
        return activeConnections.get();
    }
}
