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

import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.auth.GatewayRequestHandler;
import com.crmrealtime.gateway.errors.AuthenticationException;
import com.crmrealtime.gateway.util.HttpUtil;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/**
 * Authenticates the handshake. A failed authentication still upgrades the connection so that
 * the handler can close it with a WebSocket close code the client can read.
 */
@Slf4j
@AllArgsConstructor
public class AuthenticationInterceptor implements HandshakeInterceptor {

    static final String ATTRIBUTE_CONTEXT = "context";
    static final String ATTRIBUTE_AUTH_ERROR = "auth-error";

    private final GatewayRequestHandler gatewayRequestHandler;

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> sessionAttributes) {
        try {
            final Map<String, String> querystring =
                    HttpUtil.parseQuerystring(request.getURI().getRawQuery());
            String token = querystring.get("token");
            if (token == null || token.isBlank()) {
                token = HttpUtil.bearerToken(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
            }
            try {
                final AuthenticatedContext context =
                        gatewayRequestHandler.authenticate(
                                token,
                                querystring.get("company_id"),
                                request.getHeaders().toSingleValueMap());
                sessionAttributes.put(ATTRIBUTE_CONTEXT, context);
                log.debug("Authentication OK user_id={}", context.userId());
            } catch (AuthenticationException authFailedException) {
                log.info("Authentication failed {}", authFailedException.getMessage());
                sessionAttributes.put(ATTRIBUTE_AUTH_ERROR, authFailedException.getMessage());
            }
            return true;
        } catch (Throwable error) {
            log.info("Internal error {}", error.getMessage(), error);
            response.setStatusCode(HttpStatus.INTERNAL_SERVER_ERROR);
            return false;
        }
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception) {}
}
