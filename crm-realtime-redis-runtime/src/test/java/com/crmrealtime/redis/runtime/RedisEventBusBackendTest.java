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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusBackendRegistry;
import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.EventMetadata;
import com.crmrealtime.api.events.GdprContext;
import com.crmrealtime.redis.extensions.RedisContainerExtension;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class RedisEventBusBackendTest {

    @RegisterExtension
    static final RedisContainerExtension redisContainer = new RedisContainerExtension();

    private static EventBusBackend newBackend() {
        return EventBusBackendRegistry.loadBackend(
                "redis", Map.of("address", redisContainer.getAddress()));
    }

    private static Event event(String type) {
        return Event.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .timestamp(Instant.now())
                .data(Map.of("deal_id", 42))
                .metadata(
                        EventMetadata.builder()
                                .region("eu-west-1")
                                .idempotencyKey("k")
                                .gdprContext(GdprContext.withRetentionDays(30))
                                .build())
                .build();
    }

    @Test
    void testPatternAndExactSubscriptions() {
        try (EventBusBackend backend = newBackend()) {
            List<String> byPattern = new CopyOnWriteArrayList<>();
            List<String> exact = new CopyOnWriteArrayList<>();
            backend.subscribe(
                    List.of("crm.events.*"), (channel, event) -> byPattern.add(event.eventType()));
            backend.subscribe(
                    List.of("crm.events.deal.created"),
                    (channel, event) -> exact.add(event.eventType()));

            Event created = event("deal.created");
            assertTrue(backend.publish("crm.events.deal.created", created));
            assertTrue(backend.publish("crm.events.contact.updated", event("contact.updated")));

            Awaitility.await()
                    .untilAsserted(
                            () ->
                                    assertEquals(
                                            List.of("deal.created", "contact.updated"),
                                            byPattern));
            assertEquals(List.of("deal.created"), exact);
        }
    }

    @Test
    void testEnvelopeSurvivesTransport() {
        try (EventBusBackend backend = newBackend()) {
            List<Event> received = new CopyOnWriteArrayList<>();
            backend.subscribe(List.of("crm.events.*"), (channel, event) -> received.add(event));
            Event event = event("timeline.entry.created");
            backend.publish("crm.events.timeline.entry.created", event);
            Awaitility.await().untilAsserted(() -> assertEquals(List.of(event), received));
        }
    }

    @Test
    void testUnsubscribe() throws Exception {
        try (EventBusBackend backend = newBackend()) {
            List<Event> received = new CopyOnWriteArrayList<>();
            backend.subscribe(List.of("crm.events.*"), (channel, event) -> received.add(event));
            backend.unsubscribe(List.of("crm.events.*"));
            backend.publish("crm.events.deal.created", event("deal.created"));
            TimeUnit.MILLISECONDS.sleep(300);
            assertTrue(received.isEmpty());
        }
    }

    @Test
    void testPublishAfterClose() {
        EventBusBackend backend = newBackend();
        backend.close();
        assertFalse(backend.publish("crm.events.deal.created", event("deal.created")));
    }
}
