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
package com.crmrealtime.gateway.events;

import com.crmrealtime.api.bus.ChannelPatterns;
import com.crmrealtime.api.events.Event;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.subscriptions.Subscriber;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Receives every event of the namespace from the bus and hands it to matching subscribers. */
@Slf4j
public class EventDispatcher {

    private final EventBus eventBus;
    private final SubscriptionRegistry registry;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final String namespace;

    public EventDispatcher(
            EventBus eventBus, SubscriptionRegistry registry, GatewayMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.namespace = ChannelPatterns.namespace(eventBus.channelPrefix());
    }

    public void start() {
        eventBus.subscribe(namespace, (channel, event) -> dispatch(event));
        log.info("Dispatching events from {}", namespace);
    }

    public void stop() {
        eventBus.unsubscribe(namespace);
    }

    void dispatch(Event event) {
        final List<Subscriber> subscribers = registry.resolve(event);
        if (subscribers.isEmpty()) {
            log.debug("No subscriber for event_id={} event_type={}", event.eventId(), event.eventType());
            return;
        }
        for (Subscriber subscriber : subscribers) {
            try {
                subscriber.deliver(event);
            } catch (Exception e) {
                log.error(
                        "Cannot deliver event_id={} to subscriber={}",
                        event.eventId(),
                        subscriber.id(),
                        e);
            }
        }
        metrics.deliveryLatency(Duration.between(event.timestamp(), clock.instant()));
    }
}
