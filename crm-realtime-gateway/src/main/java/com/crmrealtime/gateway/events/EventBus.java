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
import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusListener;
import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.GdprContext;
import com.crmrealtime.gateway.GatewayMetrics;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide entry point for publishing. Wraps the configured backend, which is created once
 * and shared by every component of the gateway.
 */
@Slf4j
public class EventBus {

    private final EventBusBackend backend;
    private final DeliveryTracker tracker;
    private final String channelPrefix;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private volatile boolean started;
    private volatile boolean lastPublishFailed;

    public EventBus(
            EventBusBackend backend,
            DeliveryTracker tracker,
            String channelPrefix,
            GatewayMetrics metrics,
            Clock clock) {
        this.backend = backend;
        this.tracker = tracker;
        this.channelPrefix = channelPrefix;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void init() {
        started = true;
        log.info(
                "Event bus started backend={} channel_prefix={}",
                backend.getClass().getSimpleName(),
                channelPrefix);
    }

    public void shutdown() {
        if (!started) {
            return;
        }
        started = false;
        backend.close();
        log.info("Event bus stopped");
    }

    public boolean publishEvent(String eventType, Map<String, Object> data) {
        return publishEvent(eventType, data, null, null, null);
    }

    /**
     * Publish an event on the channel of its type.
     *
     * @return false if the bus is not started or the backend could not accept the event
     * @throws com.crmrealtime.gateway.errors.ValidationException if the event type is malformed
     */
    public boolean publishEvent(
            String eventType,
            Map<String, Object> data,
            String region,
            GdprContext gdprContext,
            String idempotencyKey) {
        final Event event =
                tracker.prepare(
                        eventType, data, clock.instant(), region, gdprContext, idempotencyKey);
        final String channel = ChannelPatterns.channelFor(channelPrefix, eventType);
        final boolean ok = started && backend.publish(channel, event);
        lastPublishFailed = !ok;
        metrics.published(ok);
        if (ok) {
            log.info(
                    "Published event_id={} event_type={} region={} timestamp={}",
                    event.eventId(),
                    event.eventType(),
                    event.metadata().region(),
                    event.timestamp());
        } else {
            log.error(
                    "Failed to publish event_id={} event_type={} region={} timestamp={} started={}",
                    event.eventId(),
                    event.eventType(),
                    event.metadata().region(),
                    event.timestamp(),
                    started);
        }
        return ok;
    }

    void subscribe(String channel, EventBusListener listener) {
        backend.subscribe(List.of(channel), listener);
    }

    void unsubscribe(String channel) {
        backend.unsubscribe(List.of(channel));
    }

    public String channelPrefix() {
        return channelPrefix;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isHealthy() {
        return started && !lastPublishFailed;
    }

    public int defaultRetentionDays() {
        return tracker.defaultRetentionDays();
    }
}
