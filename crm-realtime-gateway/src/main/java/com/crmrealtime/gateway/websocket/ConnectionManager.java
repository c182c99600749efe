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

import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.MetricsNames;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

/** Live WebSocket connections, their writer threads and the idle sweeper. */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();
    private final int outboundQueueSize;
    private final Duration idleTimeout;
    private final Duration idleCheckInterval;
    private final SubscriptionRegistry registry;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final ExecutorService writers =
            Executors.newCachedThreadPool(
                    new BasicThreadFactory.Builder()
                            .namingPattern("ws-writer-%d")
                            .daemon(true)
                            .build());
    private final ScheduledExecutorService idleSweeper =
            Executors.newSingleThreadScheduledExecutor(
                    new BasicThreadFactory.Builder()
                            .namingPattern("ws-idle-sweeper-%d")
                            .daemon(true)
                            .build());

    public ConnectionManager(
            int outboundQueueSize,
            Duration idleTimeout,
            Duration idleCheckInterval,
            SubscriptionRegistry registry,
            GatewayMetrics metrics,
            Clock clock) {
        this.outboundQueueSize = outboundQueueSize;
        this.idleTimeout = idleTimeout;
        this.idleCheckInterval = idleCheckInterval;
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void start() {
        metrics.gauge(MetricsNames.WEBSOCKET_CONNECTIONS, connections::size);
        idleSweeper.scheduleWithFixedDelay(
                this::sweepIdle,
                idleCheckInterval.toMillis(),
                idleCheckInterval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info(
                "WebSocket connections: outbound_queue_size={} idle_timeout={}",
                outboundQueueSize,
                idleTimeout);
    }

    GatewayConnection open(WebSocketSession session) {
        final GatewayConnection connection =
                new GatewayConnection(session, outboundQueueSize, registry, metrics, clock);
        connections.put(session.getId(), connection);
        connection.startWriter(writers);
        return connection;
    }

    GatewayConnection get(WebSocketSession session) {
        return connections.get(session.getId());
    }

    void closed(WebSocketSession session, CloseStatus status) {
        final GatewayConnection connection = connections.remove(session.getId());
        if (connection == null) {
            return;
        }
        connection.closed();
        log.info(
                "WebSocket disconnected connection_id={} user_id={} close_code={} received={} sent={} errors={}",
                connection.id(),
                connection.userId(),
                status.getCode(),
                connection.messagesReceived(),
                connection.messagesSent(),
                connection.errors());
    }

    void sweepIdle() {
        try {
            final Instant now = clock.instant();
            for (GatewayConnection connection : connections.values()) {
                if (connection.isIdle(now, idleTimeout)) {
                    log.info(
                            "Closing idle connection_id={} user_id={}",
                            connection.id(),
                            connection.userId());
                    connection.close(CloseCodes.IDLE_TIMEOUT);
                }
            }
        } catch (Exception e) {
            log.error("Idle sweep failed", e);
        }
    }

    public int size() {
        return connections.size();
    }

    @Override
    public void close() {
        idleSweeper.shutdownNow();
        connections.values().forEach(c -> c.close(CloseStatus.GOING_AWAY));
        // let the queued close handshakes go out
        writers.shutdown();
        try {
            if (!writers.awaitTermination(5, TimeUnit.SECONDS)) {
                writers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writers.shutdownNow();
        }
    }
}
