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

import com.crmrealtime.gateway.api.HealthResponse;
import com.crmrealtime.gateway.events.EventBus;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.crmrealtime.gateway.websocket.ConnectionManager;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@AllArgsConstructor
public class HealthResource {

    private final EventBus eventBus;
    private final SubscriptionRegistry registry;
    private final ConnectionManager connectionManager;
    private final Clock clock;

    @GetMapping("/health")
    ResponseEntity<HealthResponse> health() {
        final boolean busHealthy = eventBus.isHealthy();
        final Map<String, Object> bus = new LinkedHashMap<>();
        bus.put("status", status(busHealthy));
        bus.put("started", eventBus.isStarted());

        final Map<String, Object> subscriptions = new LinkedHashMap<>();
        subscriptions.put("status", HealthResponse.HEALTHY);
        subscriptions.put("entries", registry.liveEntryCount());
        subscriptions.put("subscribers", registry.subscriberCount());
        subscriptions.put("connections", connectionManager.size());

        final Map<String, Object> components = new LinkedHashMap<>();
        components.put("event_bus", bus);
        components.put("registry", subscriptions);
        return ResponseEntity.status(busHealthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse(status(busHealthy), components, clock.instant()));
    }

    private static String status(boolean healthy) {
        return healthy ? HealthResponse.HEALTHY : HealthResponse.UNHEALTHY;
    }
}
