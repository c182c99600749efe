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
package com.crmrealtime.gateway.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.GdprContext;
import com.crmrealtime.gateway.errors.ValidationException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DeliveryTrackerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void testDefaults() {
        AtomicInteger ids = new AtomicInteger();
        DeliveryTracker tracker =
                new DeliveryTracker("us-east-1", 365, () -> "evt-" + ids.incrementAndGet());
        Event event =
                tracker.prepare("deal.stage.updated", Map.of("deal_id", 42), NOW, null, null, null);

        assertEquals("evt-1", event.eventId());
        assertEquals("deal.stage.updated", event.eventType());
        assertEquals(NOW, event.timestamp());
        assertEquals(Map.of("deal_id", 42), event.data());
        assertEquals("us-east-1", event.metadata().region());
        assertEquals("evt-1", event.idempotencyKey());
        assertEquals(365, event.metadata().gdprContext().retentionDays());
    }

    @Test
    void testSuppliedMetadataIsKept() {
        DeliveryTracker tracker = new DeliveryTracker("us-east-1", 365);
        GdprContext gdpr = GdprContext.builder().consent(true).purpose("sales").build();
        Event event = tracker.prepare("contact.created", Map.of(), NOW, "eu-west-1", gdpr, "k-1");

        assertEquals("eu-west-1", event.metadata().region());
        assertEquals("k-1", event.idempotencyKey());
        assertEquals(gdpr, event.metadata().gdprContext());
    }

    @Test
    void testSameIdempotencyKeyProducesDistinctEvents() {
        DeliveryTracker tracker = new DeliveryTracker("us-east-1", 365);
        Event first = tracker.prepare("deal.created", Map.of(), NOW, null, null, "retry-1");
        Event second = tracker.prepare("deal.created", Map.of(), NOW, null, null, "retry-1");

        assertNotEquals(first.eventId(), second.eventId());
        assertEquals(first.idempotencyKey(), second.idempotencyKey());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "deal.", ".deal", "deal..created", "deal.*", "deal stage"})
    void testMalformedEventType(String eventType) {
        DeliveryTracker tracker = new DeliveryTracker("us-east-1", 365);
        assertThrows(
                ValidationException.class,
                () -> tracker.prepare(eventType, Map.of(), NOW, null, null, null));
    }

    @Test
    void testMissingTimestamp() {
        DeliveryTracker tracker = new DeliveryTracker("us-east-1", 365);
        assertThrows(
                ValidationException.class,
                () -> tracker.prepare("deal.created", Map.of(), null, null, null, null));
        assertThrows(
                ValidationException.class,
                () -> tracker.prepare(null, Map.of(), NOW, null, null, null));
    }
}
