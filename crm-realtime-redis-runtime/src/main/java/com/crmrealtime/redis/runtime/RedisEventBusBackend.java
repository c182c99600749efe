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
package com.crmrealtime.redis.runtime;

import com.crmrealtime.api.bus.ChannelPatterns;
import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusListener;
import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.EventCodec;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RPatternTopic;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Redis Pub/Sub through Redisson. Exact channels map to {@link RTopic}, channels ending with
 * {@code *} to {@link RPatternTopic} (Redis {@code PSUBSCRIBE}). Envelopes travel as JSON text.
 */
@Slf4j
public class RedisEventBusBackend implements EventBusBackend {

    private final RedissonClient client;
    private final boolean ownsClient;
    private final Map<String, Runnable> unsubscribers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public RedisEventBusBackend(RedissonClient client, boolean ownsClient) {
        this.client = client;
        this.ownsClient = ownsClient;
    }

    @Override
    public boolean publish(String channel, Event event) {
        if (closed) {
            return false;
        }
        try {
            final long receivers =
                    client.getTopic(channel, StringCodec.INSTANCE).publish(EventCodec.encode(event));
            log.debug("Published event {} on {} to {} receivers", event.eventId(), channel, receivers);
            return true;
        } catch (Exception e) {
            log.error("Failed to publish event {} on {}", event.eventId(), channel, e);
            return false;
        }
    }

    @Override
    public void subscribe(Collection<String> channels, EventBusListener listener) {
        if (closed) {
            throw new IllegalStateException("Backend is closed");
        }
        for (String channel : channels) {
            if (ChannelPatterns.isPattern(channel)) {
                final RPatternTopic topic = client.getPatternTopic(channel, StringCodec.INSTANCE);
                final int id =
                        topic.addListener(
                                String.class,
                                (pattern, actualChannel, message) ->
                                        deliver(actualChannel.toString(), message, listener));
                unsubscribers.merge(
                        channel, () -> topic.removeListener(id), RedisEventBusBackend::both);
            } else {
                final RTopic topic = client.getTopic(channel, StringCodec.INSTANCE);
                final int id =
                        topic.addListener(
                                String.class,
                                (actualChannel, message) ->
                                        deliver(actualChannel.toString(), message, listener));
                unsubscribers.merge(
                        channel, () -> topic.removeListener(id), RedisEventBusBackend::both);
            }
        }
        log.info("Subscribed to channels {}", channels);
    }

    private static Runnable both(Runnable first, Runnable second) {
        return () -> {
            first.run();
            second.run();
        };
    }

    private static void deliver(String channel, String message, EventBusListener listener) {
        final Event event;
        try {
            event = EventCodec.decode(message);
        } catch (Exception e) {
            log.error("Cannot decode message on {}", channel, e);
            return;
        }
        try {
            listener.onEvent(channel, event);
        } catch (Throwable error) {
            log.error("Listener failed on {} for event {}", channel, event.eventId(), error);
        }
    }

    @Override
    public void unsubscribe(Collection<String> channels) {
        for (String channel : channels) {
            final Runnable unsubscriber = unsubscribers.remove(channel);
            if (unsubscriber != null) {
                unsubscriber.run();
            }
        }
        log.info("Unsubscribed from channels {}", channels);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        unsubscribe(Set.copyOf(unsubscribers.keySet()));
        if (ownsClient) {
            client.shutdown();
        }
        log.info("Redis event bus closed");
    }
}
