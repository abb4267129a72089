package com.di.phaselink.bus;

import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the bus implementation from phaselink.bus.type. */
@Slf4j
@Configuration
public class BusConfig {

    @Bean
    public DeliveryPolicy deliveryPolicy(PhaseLinkProperties properties) {
        return DeliveryPolicy.from(properties.getBus());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "phaselink.bus.type", havingValue = "local", matchIfMissing = true)
    public EventBus localEventBus(ChangeEventCodec codec, DeliveryPolicy policy, PipelineMetrics metrics) {
        log.info("[BUS] Using in-process bus (maxDeliveryAttempts={}, initialBackoff={})",
                policy.getMaxDeliveryAttempts(), policy.getInitialBackoff());
        return new LocalEventBus(codec, policy, metrics);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "phaselink.bus.type", havingValue = "pubsub")
    public EventBus pubSubEventBus(PhaseLinkProperties properties, ChangeEventCodec codec,
                                   DeliveryPolicy policy, PipelineMetrics metrics) {
        PhaseLinkProperties.PubSub pubsub = properties.getBus().getPubsub();
        log.info("[BUS] Using Pub/Sub bus (project={})", pubsub.getProjectId());
        return new PubSubEventBus(pubsub.getProjectId(), codec, policy, metrics, pubsub.getPublishTimeout());
    }
}
