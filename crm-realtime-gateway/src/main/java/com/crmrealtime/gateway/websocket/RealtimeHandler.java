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

import com.crmrealtime.api.events.EventCodec;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.api.ClientMessage;
import com.crmrealtime.gateway.api.ServerMessage;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.errors.ValidationException;
import com.crmrealtime.gateway.subscriptions.TopicValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Slf4j
public class RealtimeHandler extends TextWebSocketHandler {

    public static final String PATH = "/ws";

    private final ConnectionManager connectionManager;
    private final TopicValidator topicValidator;
    private final GatewayMetrics metrics;
    private final Clock clock;

    public RealtimeHandler(
            ConnectionManager connectionManager,
            TopicValidator topicValidator,
            GatewayMetrics metrics,
            Clock clock) {
        this.connectionManager = connectionManager;
        this.topicValidator = topicValidator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        final GatewayConnection connection = connectionManager.open(session);
        try {
            connection.authenticating();
            final AuthenticatedContext context =
                    (AuthenticatedContext)
                            session.getAttributes().get(AuthenticationInterceptor.ATTRIBUTE_CONTEXT);
            if (context == null) {
                final Object reason =
                        session.getAttributes().get(AuthenticationInterceptor.ATTRIBUTE_AUTH_ERROR);
                metrics.webSocketError("authentication");
                connection.reject(reason == null ? null : reason.toString());
                return;
            }
            connection.activate(context);
            connection.send(
                    ServerMessage.connectionEstablished(
                            connection.id(),
                            context.userId(),
                            context.companyId(),
                            clock.instant()));
            log.info(
                    "WebSocket connected connection_id={} user_id={} company_id={}",
                    connection.id(),
                    context.userId(),
                    context.companyId());
        } catch (Throwable throwable) {
            log.error("[{}] error while opening websocket", session.getId(), throwable);
            connection.recordError();
            connection.close(CloseCodes.INTERNAL_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        final GatewayConnection connection = connectionManager.get(session);
        if (connection == null || connection.state() != ConnectionState.ACTIVE) {
            return;
        }
        connection.received();
        final ClientMessage clientMessage;
        try {
            clientMessage =
                    EventCodec.mapper().readValue(message.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            sendError(connection, "Invalid JSON format", List.of());
            return;
        }
        try {
            handle(connection, clientMessage);
        } catch (ValidationException e) {
            sendError(connection, e.getMessage(), e.getRejected());
        } catch (Exception e) {
            log.error("[{}] error handling {}", connection.id(), clientMessage.type(), e);
            connection.recordError();
            connection.send(
                    ServerMessage.error(
                            ServerMessage.CATEGORY_INTERNAL,
                            "Internal error",
                            List.of(),
                            clock.instant()));
        }
    }

    private void handle(GatewayConnection connection, ClientMessage message) {
        final String type = message.type() == null ? "" : message.type();
        switch (type) {
            case ClientMessage.SUBSCRIBE -> {
                final List<String> topics = topicValidator.validate(message.topics());
                connection.subscribe(topics);
                connection.send(ServerMessage.subscriptionConfirmed(topics, clock.instant()));
                log.info("[{}] subscribed to {}", connection.id(), topics);
            }
            case ClientMessage.UNSUBSCRIBE -> {
                if (message.topics() == null || message.topics().isEmpty()) {
                    final List<String> removed = connection.unsubscribeAll();
                    connection.send(
                            ServerMessage.unsubscriptionConfirmed(removed, true, clock.instant()));
                } else {
                    final List<String> topics = topicValidator.validate(message.topics());
                    connection.unsubscribe(topics);
                    connection.send(
                            ServerMessage.unsubscriptionConfirmed(topics, false, clock.instant()));
                }
                log.info("[{}] unsubscribed from {}", connection.id(), message.topics());
            }
            case ClientMessage.CURSOR_UPDATE -> {
                connection.updateCursor(message.cursor());
                connection.send(ServerMessage.cursorUpdated(message.cursor(), clock.instant()));
            }
            case ClientMessage.PING -> connection.send(ServerMessage.pong(clock.instant()));
            default -> throw new ValidationException("Unknown message type: " + message.type());
        }
    }

    private void sendError(GatewayConnection connection, String message, List<String> rejected) {
        connection.recordError();
        metrics.webSocketError("validation");
        connection.send(
                ServerMessage.error(
                        ServerMessage.CATEGORY_VALIDATION, message, rejected, clock.instant()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[{}] transport error: {}", session.getId(), exception.getMessage());
        metrics.webSocketError("transport");
        final GatewayConnection connection = connectionManager.get(session);
        if (connection != null) {
            connection.recordError();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionManager.closed(session, status);
    }
}
