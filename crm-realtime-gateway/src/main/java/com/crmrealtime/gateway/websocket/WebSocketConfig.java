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
import com.crmrealtime.gateway.auth.GatewayRequestHandler;
import com.crmrealtime.gateway.subscriptions.TopicValidator;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@EnableWebSocket
@Configuration
@Slf4j
@AllArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConnectionManager connectionManager;
    private final TopicValidator topicValidator;
    private final GatewayRequestHandler gatewayRequestHandler;
    private final GatewayMetrics metrics;
    private final Clock clock;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(
                        new RealtimeHandler(connectionManager, topicValidator, metrics, clock),
                        RealtimeHandler.PATH)
                .setAllowedOrigins("*")
                .addInterceptors(new AuthenticationInterceptor(gatewayRequestHandler));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        return new ServletServerContainerFactoryBean();
    }

    @PreDestroy
    public void onDestroy() {
        log.info("Shutting down WebSocket");
        connectionManager.close();
    }
}
