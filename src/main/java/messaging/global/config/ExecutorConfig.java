package messaging.global.config;

import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * 소켓 쓰기를 담당하는 clientOutboundChannel 풀의 executor_* 메트릭.
     * 풀 크기는 WebSocketConfig 에서 app.realtime.outbound.* 로 정한다.
     */
    @Bean
    public MeterBinder realtimeOutboundExecutorMetrics(
            @Qualifier("clientOutboundChannelExecutor") ThreadPoolTaskExecutor clientOutboundChannelExecutor) {
        return registry -> new ExecutorServiceMetrics(
                clientOutboundChannelExecutor.getThreadPoolExecutor(), "realtime-outbound", Tags.empty())
                .bindTo(registry);
    }
}
