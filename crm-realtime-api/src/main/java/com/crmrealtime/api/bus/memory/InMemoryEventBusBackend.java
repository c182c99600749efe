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
package com.crmrealtime.api.bus.memory;

import com.crmrealtime.api.bus.ChannelPatterns;
import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusListener;
import com.crmrealtime.api.events.Event;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

/**
 * In-process broker. Listeners matching a channel are resolved when the event is published and
 * invoked from a single dispatch thread, so every listener sees events in publish order.
 */
@Slf4j
public class InMemoryEventBusBackend implements EventBusBackend {

    private final Map<String, List<EventBusListener>> subscriptions = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher;
    private volatile boolean closed;

    public InMemoryEventBusBackend() {
        this(
                Executors.newSingleThreadExecutor(
                        new BasicThreadFactory.Builder()
                                .namingPattern("memory-bus-dispatch-%d")
                                .daemon(true)
                                .build()));
    }

    InMemoryEventBusBackend(ExecutorService dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean publish(String channel, Event event) {
        if (closed) {
            log.warn("Cannot publish {} to {}: backend is closed", event.eventId(), channel);
            return false;
        }
        final List<EventBusListener> targets = matchingListeners(channel);
        if (targets.isEmpty()) {
            log.debug("No subscribers on {}, event {} not delivered", channel, event.eventId());
            return true;
        }
        try {
            dispatcher.execute(() -> deliver(channel, event, targets));
            return true;
        } catch (RejectedExecutionException e) {
            log.error("Dispatcher rejected event {} on {}", event.eventId(), channel, e);
            return false;
        }
    }

    private List<EventBusListener> matchingListeners(String channel) {
        final List<EventBusListener> result = new ArrayList<>();
        subscriptions.forEach(
                (pattern, listeners) -> {
                    if (ChannelPatterns.matches(pattern, channel)) {
                        result.addAll(listeners);
                    }
                });
        return result;
    }

    private static void deliver(String channel, Event event, List<EventBusListener> targets) {
        for (EventBusListener listener : targets) {
            try {
                listener.onEvent(channel, event);
            } catch (Throwable error) {
                log.error("Listener failed on {} for event {}", channel, event.eventId(), error);
            }
        }
    }

    @Override
    public void subscribe(Collection<String> channels, EventBusListener listener) {
        if (closed) {
            throw new IllegalStateException("Backend is closed");
        }
        for (String channel : channels) {
            subscriptions.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>()).add(listener);
        }
        log.info("Subscribed to channels {}", channels);
    }

    @Override
    public void unsubscribe(Collection<String> channels) {
        channels.forEach(subscriptions::remove);
        log.info("Unsubscribed from channels {}", channels);
    }

    @Override
    public void close() {
        closed = true;
        subscriptions.clear();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        log.info("In-memory event bus closed");
    }
}
