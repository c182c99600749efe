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
package com.crmrealtime.gateway.poll;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crmrealtime.api.events.Event;
import com.crmrealtime.gateway.GatewayMetrics;
import com.crmrealtime.gateway.MetricsNames;
import com.crmrealtime.gateway.api.PollResponse;
import com.crmrealtime.gateway.auth.AuthenticatedContext;
import com.crmrealtime.gateway.errors.ValidationException;
import com.crmrealtime.gateway.subscriptions.Subscriber;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.crmrealtime.gateway.subscriptions.TopicValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LongPollServiceTest {

    private static final AuthenticatedContext USER =
            new AuthenticatedContext("u-1", "acme", "u1@acme.test");

    private SimpleMeterRegistry meterRegistry;
    private SubscriptionRegistry registry;
    private LongPollService service;

    @BeforeEach
    void setup() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new SubscriptionRegistry();
        service =
                new LongPollService(
                        registry,
                        new TopicValidator(List.of("deal.", "contact.")),
                        new GatewayMetrics(meterRegistry),
                        Clock.systemUTC(),
                        30,
                        60,
                        3);
    }

    @AfterEach
    void teardown() {
        service.close();
    }

    private static Event event(String type) {
        return Event.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .timestamp(Instant.now())
                .data(Map.of("deal_id", 42))
                .build();
    }

    private void dispatch(Event event) {
        for (Subscriber subscriber : registry.resolve(event)) {
            subscriber.deliver(event);
        }
    }

    @Test
    void testResolveTimeout() {
        assertEquals(Duration.ofSeconds(30), service.resolveTimeout(null));
        assertEquals(Duration.ofSeconds(30), service.resolveTimeout(" "));
        assertEquals(Duration.ofSeconds(5), service.resolveTimeout("5"));
        assertEquals(Duration.ofSeconds(60), service.resolveTimeout("600"));
        assertThrows(ValidationException.class, () -> service.resolveTimeout("0"));
        assertThrows(ValidationException.class, () -> service.resolveTimeout("-3"));
        assertThrows(ValidationException.class, () -> service.resolveTimeout("soon"));
    }

    @Test
    void testParseTopics() {
        assertEquals(List.of("deal.*", "contact.created"), service.parseTopics("deal.*, contact.created"));
        assertThrows(ValidationException.class, () -> service.parseTopics(""));
        assertThrows(ValidationException.class, () -> service.parseTopics(","));
        ValidationException e =
                assertThrows(
                        ValidationException.class, () -> service.parseTopics("deal.*,invoice.*"));
        assertEquals(List.of("invoice.*"), e.getRejected());
    }

    @Test
    void testTimeoutReturnsEmptyWithinDeadline() throws Exception {
        long start = System.nanoTime();
        PollResponse response =
                service.poll(USER, List.of("deal.*"), "c-0", Duration.ofSeconds(1))
                        .get(5, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(response.events().isEmpty());
        assertFalse(response.hasMore());
        assertEquals("c-0", response.cursor());
        assertTrue(elapsedMillis >= 900, "returned too early: " + elapsedMillis);
        assertTrue(elapsedMillis < 1900, "returned too late: " + elapsedMillis);
        assertEquals(0, registry.liveEntryCount());
        assertEquals(
                1.0,
                meterRegistry
                        .get(MetricsNames.LONGPOLL_REQUESTS)
                        .tag("outcome", "timeout")
                        .counter()
                        .count());
    }

    @Test
    void testFreshCursorWhenNoneSupplied() throws Exception {
        PollResponse response =
                service.poll(USER, List.of("deal.*"), null, Duration.ofMillis(100))
                        .get(5, TimeUnit.SECONDS);
        assertNotNull(response.cursor());
    }

    @Test
    void testFirstEventCompletesPoll() throws Exception {
        CompletableFuture<PollResponse> future =
                service.poll(USER, List.of("deal.stage.*"), null, Duration.ofSeconds(30));
        assertEquals(1, registry.liveEntryCount());

        Event event = event("deal.stage.updated");
        dispatch(event("contact.created"));
        dispatch(event);

        PollResponse response = future.get(5, TimeUnit.SECONDS);
        assertEquals(List.of(event), response.events());
        assertEquals(event.eventId(), response.cursor());
        assertFalse(response.hasMore());
        assertEquals(0, registry.liveEntryCount());
    }

    @Test
    void testFullBatchFlushesAtOnceAndSetsHasMore() throws Exception {
        CompletableFuture<PollResponse> future =
                service.poll(USER, List.of("deal.*"), null, Duration.ofSeconds(30));
        List<Event> events =
                List.of(
                        event("deal.created"),
                        event("deal.updated"),
                        event("deal.deleted"),
                        event("deal.restored"),
                        event("deal.archived"));
        // delivered back to back, inside the batching window
        events.subList(0, 3).forEach(this::dispatch);

        // the third event fills the batch: no wait for the window, and the waiter is gone
        assertTrue(future.isDone());
        assertEquals(0, registry.liveEntryCount());
        events.subList(3, 5).forEach(this::dispatch);

        PollResponse response = future.get(5, TimeUnit.SECONDS);
        assertEquals(events.subList(0, 3), response.events());
        assertTrue(response.hasMore());
        assertEquals(events.get(2).eventId(), response.cursor());
    }

    @Test
    void testTenantScopedPoll() throws Exception {
        CompletableFuture<PollResponse> future =
                service.poll(USER, List.of("deal.*"), null, Duration.ofSeconds(1));
        Event other =
                Event.builder()
                        .eventId(UUID.randomUUID().toString())
                        .eventType("deal.created")
                        .timestamp(Instant.now())
                        .data(Map.of("company_id", "globex"))
                        .build();
        dispatch(other);

        assertTrue(future.get(5, TimeUnit.SECONDS).events().isEmpty());
    }

    @Test
    void testCancellationReleasesRegistration() {
        CompletableFuture<PollResponse> future =
                service.poll(USER, List.of("deal.*", "contact.*"), null, Duration.ofSeconds(30));
        assertEquals(2, registry.liveEntryCount());

        future.cancel(false);

        Awaitility.await().untilAsserted(() -> assertEquals(0, registry.liveEntryCount()));
        assertEquals(
                1.0,
                meterRegistry
                        .get(MetricsNames.LONGPOLL_REQUESTS)
                        .tag("outcome", "cancelled")
                        .counter()
                        .count());
    }
}
