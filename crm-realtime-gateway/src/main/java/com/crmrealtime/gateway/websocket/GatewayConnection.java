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
package com.crmrealtime.gateway.websocket;

import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.EventCodec;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.api.ServerMessage;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.subscriptions.Subscriber;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * One client socket. Every outgoing frame goes through a bounded queue drained by a single writer
 * task, so the session is written by one thread only. When the queue is full the client is too
 * slow: the connection leaves the registry at once and is closed with {@link
 * CloseCodes#SLOW_CONSUMER}.
 */
@Slf4j
public class GatewayConnection implements Subscriber {

    private static final TextMessage STOP = new TextMessage("{}");

    private final String connectionId = UUID.randomUUID().toString();
    private final WebSocketSession session;
    private final SubscriptionRegistry registry;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final BlockingQueue<TextMessage> outbound;
    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.CONNECTING);
    private final Set<String> subscribedTopics = ConcurrentHashMap.newKeySet();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile String userId;
    private volatile String companyId;
    private volatile String lastCursor;
    private volatile Instant lastActivity;
    private volatile Future<?> writer;
    private volatile ExecutorService executor;

    GatewayConnection(
            WebSocketSession session,
            int outboundQueueSize,
            SubscriptionRegistry registry,
            GatewayMetrics metrics,
            Clock clock) {
        this.session = session;
        this.outbound = new ArrayBlockingQueue<>(outboundQueueSize);
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    void startWriter(ExecutorService executor) {
        this.executor = executor;
        writer = executor.submit(this::drain);
    }

    private void drain() {
        try {
            while (true) {
                final TextMessage message = outbound.take();
                if (message == STOP) {
                    return;
                }
                session.sendMessage(message);
                messagesSent.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | RuntimeException e) {
            errors.incrementAndGet();
            metrics.webSocketError("send");
            log.warn("[{}] cannot write to socket: {}", connectionId, e.getMessage());
            close(CloseStatus.SERVER_ERROR);
        }
    }

    private boolean transitionTo(ConnectionState next) {
        while (true) {
            final ConnectionState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.debug("[{}] {} -> {}", connectionId, current, next);
                return true;
            }
        }
    }

    void authenticating() {
        transitionTo(ConnectionState.AUTHENTICATING);
    }

    void activate(AuthenticatedContext context) {
        this.userId = context.userId();
        this.companyId = context.companyId();
        this.lastActivity = clock.instant();
        if (!transitionTo(ConnectionState.ACTIVE)) {
            throw new IllegalStateException("Cannot activate connection in state " + state.get());
        }
    }

    void reject(String reason) {
        if (transitionTo(ConnectionState.REJECTED)) {
            stopWriter();
            closeSession(CloseCodes.authenticationFailed(reason));
        }
    }

    /** Records client activity, for the idle sweeper. */
    void received() {
        messagesReceived.incrementAndGet();
        lastActivity = clock.instant();
    }

    boolean isIdle(Instant now, Duration idleTimeout) {
        return state.get() == ConnectionState.ACTIVE
                && Duration.between(lastActivity, now).compareTo(idleTimeout) >= 0;
    }

    void subscribe(Collection<String> topics) {
        subscribedTopics.addAll(topics);
        registry.register(this, topics);
    }

    void unsubscribe(Collection<String> topics) {
        subscribedTopics.removeAll(topics);
        registry.unregister(this, topics);
    }

    List<String> unsubscribeAll() {
        final List<String> topics = new ArrayList<>(subscribedTopics);
        subscribedTopics.clear();
        registry.unregisterAll(this);
        return topics;
    }

    void updateCursor(String cursor) {
        this.lastCursor = cursor;
    }

    /**
     * Queue a frame for the writer.
     *
     * @return false if the connection is not active or the frame overflowed the queue
     */
    boolean send(ServerMessage message) {
        if (state.get() != ConnectionState.ACTIVE) {
            return false;
        }
        final TextMessage frame;
        try {
            frame = new TextMessage(EventCodec.mapper().writeValueAsString(message));
        } catch (JsonProcessingException e) {
            errors.incrementAndGet();
            log.error("[{}] cannot encode {} frame", connectionId, message.type(), e);
            return false;
        }
        if (!outbound.offer(frame)) {
            onSlowConsumer();
            return false;
        }
        return true;
    }

    private void onSlowConsumer() {
        log.warn(
                "[{}] outbound queue full ({} frames), closing slow consumer user_id={}",
                connectionId,
                outbound.size(),
                userId);
        metrics.dropped("slow_consumer");
        close(CloseCodes.SLOW_CONSUMER);
    }

    @Override
    public void deliver(Event event) {
        if (send(ServerMessage.event(event))) {
            metrics.delivered(GatewayMetrics.Transport.websocket);
        }
    }

    /**
     * Server side close. Subscriptions are removed on the calling thread; the close handshake runs
     * on the writer pool, since it can block behind a stuck send.
     */
    public void close(CloseStatus status) {
        if (!transitionTo(ConnectionState.CLOSING)) {
            return;
        }
        registry.unregisterAll(this);
        subscribedTopics.clear();
        stopWriter();
        final ExecutorService closer = executor;
        if (closer == null) {
            closeSession(status);
            return;
        }
        try {
            closer.execute(() -> closeSession(status));
        } catch (RejectedExecutionException e) {
            closeSession(status);
        }
    }

    /** The socket is gone, whoever closed it. */
    void closed() {
        state.updateAndGet(
                current ->
                        current == ConnectionState.REJECTED ? current : ConnectionState.CLOSED);
        registry.unregisterAll(this);
        subscribedTopics.clear();
        stopWriter();
    }

    private void stopWriter() {
        outbound.clear();
        if (!outbound.offer(STOP) && writer != null) {
            writer.cancel(true);
        }
    }

    private void closeSession(CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("[{}] error while closing socket: {}", connectionId, e.getMessage());
        }
    }

    void recordError() {
        errors.incrementAndGet();
    }

    @Override
    public String id() {
        return connectionId;
    }

    @Override
    public String companyId() {
        return companyId;
    }

    public String userId() {
        return userId;
    }

    public ConnectionState state() {
        return state.get();
    }

    public Set<String> subscribedTopics() {
        return Set.copyOf(subscribedTopics);
    }

    public String lastCursor() {
        return lastCursor;
    }

    public long messagesReceived() {
        return messagesReceived.get();
    }

    public long messagesSent() {
        return messagesSent.get();
    }

    public long errors() {
        return errors.get();
    }
}
