/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.crmrealtime.gateway.config;

import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusBackendRegistry;
import com.crmrealtime.api.gateway.GatewayAuthenticationProvider;
import com.crmrealtime.api.gateway.GatewayAuthenticationProviderRegistry;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.MetricsNames;
import com.crmrealtime.gateway.auth.GatewayRequestHandler;
import com.crmrealtime.gateway.events.DeliveryTracker;
import com.crmrealtime.gateway.events.EventBus;
import com.crmrealtime.gateway.events.EventDispatcher;
import com.crmrealtime.gateway.events.RecordChangePublisher;
import com.crmrealtime.gateway.poll.LongPollService;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.crmrealtime.gateway.subscriptions.TopicValidator;
import com.crmrealtime.gateway.websocket.ConnectionManager;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class GatewayConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GatewayMetrics gatewayMetrics(MeterRegistry meterRegistry) {
        return new GatewayMetrics(meterRegistry);
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry(GatewayMetrics metrics) {
        final SubscriptionRegistry registry = new SubscriptionRegistry();
        metrics.gauge(MetricsNames.SUBSCRIPTION_ENTRIES, registry::liveEntryCount);
        return registry;
    }

    @Bean
    public TopicValidator topicValidator(GatewayProperties properties) {
        return new TopicValidator(properties.getTopics().getAllowedPrefixes());
    }

    @Bean
    public DeliveryTracker deliveryTracker(GatewayProperties properties) {
        return new DeliveryTracker(
                properties.getDefaults().getRegion(), properties.getDefaults().getRetentionDays());
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public EventBus eventBus(
            GatewayProperties properties,
            DeliveryTracker deliveryTracker,
            GatewayMetrics metrics,
            Clock clock) {
        final GatewayProperties.EventBusProperties busProperties = properties.getEventBus();
        log.info("Loading event bus backend type={}", busProperties.getType());
        final EventBusBackend backend =
                EventBusBackendRegistry.loadBackend(
                        busProperties.getType(), busProperties.getConfiguration());
        return new EventBus(
                backend, deliveryTracker, busProperties.getChannelPrefix(), metrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public EventDispatcher eventDispatcher(
            EventBus eventBus, SubscriptionRegistry registry, GatewayMetrics metrics, Clock clock) {
        return new EventDispatcher(eventBus, registry, metrics, clock);
    }

    @Bean
    public RecordChangePublisher recordChangePublisher(EventBus eventBus) {
        return new RecordChangePublisher(eventBus);
    }

    @Bean
    public GatewayRequestHandler gatewayRequestHandler(GatewayProperties properties) {
        final GatewayProperties.AuthenticationProperties authentication =
                properties.getAuthentication();
        final GatewayAuthenticationProvider provider =
                GatewayAuthenticationProviderRegistry.loadProvider(
                        authentication.getType(), authentication.getConfiguration());
        return new GatewayRequestHandler(provider);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public ConnectionManager connectionManager(
            GatewayProperties properties,
            SubscriptionRegistry registry,
            GatewayMetrics metrics,
            Clock clock) {
        final GatewayProperties.WebSocketProperties websocket = properties.getWebsocket();
        return new ConnectionManager(
                websocket.getOutboundQueueSize(),
                Duration.ofSeconds(websocket.getIdleTimeoutSeconds()),
                Duration.ofSeconds(websocket.getIdleCheckIntervalSeconds()),
                registry,
                metrics,
                clock);
    }

    @Bean(destroyMethod = "close")
    public LongPollService longPollService(
            GatewayProperties properties,
            SubscriptionRegistry registry,
            TopicValidator topicValidator,
            GatewayMetrics metrics,
            Clock clock) {
        final GatewayProperties.PollProperties poll = properties.getPoll();
        return new LongPollService(
                registry,
                topicValidator,
                metrics,
                clock,
                poll.getDefaultTimeoutSeconds(),
                poll.getMaxTimeoutSeconds(),
                poll.getMaxBatchSize());
    }
}
