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
package com.crmrealtime.gateway.http;

import com.crmrealtime.gateway.api.PublishRequest;
import com.crmrealtime.gateway.api.PublishResponse;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.auth.GatewayRequestHandler;
import com.crmrealtime.gateway.errors.AuthenticationException;
import com.crmrealtime.gateway.errors.ValidationException;
import com.crmrealtime.gateway.events.EventBus;
import com.crmrealtime.gateway.util.HttpUtil;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Lets HTTP clients publish events on behalf of the authenticated user. */
@RestController
@RequestMapping("/api/events")
@Slf4j
@AllArgsConstructor
public class EventsResource {

    private final EventBus eventBus;
    private final GatewayRequestHandler gatewayRequestHandler;

    @PostMapping
    ResponseEntity<PublishResponse> publish(
            @RequestBody PublishRequest request,
            @RequestParam(value = "company_id", required = false) String companyId,
            @RequestHeader HttpHeaders headers)
            throws AuthenticationException {
        final AuthenticatedContext context =
                gatewayRequestHandler.authenticate(
                        HttpUtil.bearerToken(headers.getFirst(HttpHeaders.AUTHORIZATION)),
                        companyId,
                        headers.toSingleValueMap());
        if (request == null) {
            throw new ValidationException("Missing request body");
        }
        final Map<String, Object> data = new LinkedHashMap<>();
        if (request.data() != null) {
            data.putAll(request.data());
        }
        data.put("user_id", context.userId());
        if (context.email() != null) {
            data.put("user_email", context.email());
        }
        final boolean ok =
                eventBus.publishEvent(
                        request.eventType(),
                        data,
                        request.region(),
                        request.gdprContext(),
                        request.idempotencyKey());
        final PublishResponse response = new PublishResponse(ok, request.eventType());
        return ResponseEntity.status(ok ? HttpStatus.CREATED : HttpStatus.SERVICE_UNAVAILABLE)
                .body(response);
    }
}
