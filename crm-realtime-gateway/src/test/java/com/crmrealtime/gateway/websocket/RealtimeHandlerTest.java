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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crmrealtime.api.events.Event;
import com.crmrealtime.gateway.events.EventBus;
import com.crmrealtime.gateway.subscriptions.SubscriptionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.websocket.CloseReason;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.Cleanup;
import lombok.SneakyThrows;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"application.gateway.authentication.type=test-auth"})
class RealtimeHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newHttpClient();

    @LocalServerPort int port;

    @Autowired EventBus eventBus;

    @Autowired SubscriptionRegistry registry;

    @Autowired ConnectionManager connectionManager;

    @BeforeAll
    static void beforeAll() {
        Awaitility.setDefaultTimeout(30, TimeUnit.SECONDS);
    }

    @AfterAll
    static void afterAll() {
        Awaitility.reset();
    }

    private URI wsUri(String query) {
        return URI.create("ws://localhost:%d/ws?%s".formatted(port, query));
    }

    @SneakyThrows
    private static JsonNode parse(String frame) {
        return MAPPER.readTree(frame);
    }

    private static JsonNode awaitFrame(TestWebSocketClient client, String type) {
        Awaitility.await()
                .until(
                        () ->
                                client.messages().stream()
                                        .anyMatch(m -> type.equals(parse(m).get("type").asText())));
        return client.messages().stream()
                .map(RealtimeHandlerTest::parse)
                .filter(m -> type.equals(m.get("type").asText()))
                .findFirst()
                .orElseThrow();
    }

    private static List<JsonNode> frames(TestWebSocketClient client, String type) {
        return client.messages().stream()
                .map(RealtimeHandlerTest::parse)
                .filter(m -> type.equals(m.get("type").asText()))
                .toList();
    }

    @Test
    void testConnectionEstablished() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=test-token-alice&company_id=acme"));

        JsonNode established = awaitFrame(client, "connection.established");
        assertEquals("alice", established.get("data").get("user_id").asText());
        assertEquals("acme", established.get("data").get("company_id").asText());
        assertFalse(established.get("data").get("connection_id").asText().isEmpty());

        client.send("{\"type\":\"ping\"}");
        assertTrue(awaitFrame(client, "pong").get("data").has("timestamp"));
    }

    @Test
    void testAuthenticationFailureCloses4001() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=wrong"));

        CloseReason reason = client.closeReason().get(10, TimeUnit.SECONDS);
        assertEquals(4001, reason.getCloseCode().getCode());
        assertEquals("Invalid credentials", reason.getReasonPhrase());
        assertTrue(client.messages().isEmpty());
    }

    @Test
    void testMissingTokenCloses4001() throws Exception {
        @Cleanup TestWebSocketClient client = new TestWebSocketClient().connect(wsUri("x=y"));

        CloseReason reason = client.closeReason().get(10, TimeUnit.SECONDS);
        assertEquals(4001, reason.getCloseCode().getCode());
        assertEquals("Missing credentials", reason.getReasonPhrase());
    }

    @Test
    void testSubscriptionValidation() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=test-token-bob"));
        awaitFrame(client, "connection.established");
        int entriesBefore = registry.liveEntryCount();

        client.send("{\"type\":\"subscribe\",\"topics\":[\"deal.*\",\"invoice.*\"]}");
        JsonNode error = awaitFrame(client, "error");
        assertEquals("validation", error.get("data").get("category").asText());
        assertEquals("invoice.*", error.get("data").get("rejected").get(0).asText());
        assertEquals(entriesBefore, registry.liveEntryCount());

        client.send("not json");
        Awaitility.await().until(() -> frames(client, "error").size() == 2);
        assertEquals(
                "Invalid JSON format",
                frames(client, "error").get(1).get("data").get("message").asText());

        client.send("{\"type\":\"shout\"}");
        Awaitility.await().until(() -> frames(client, "error").size() == 3);
        assertEquals(
                "Unknown message type: shout",
                frames(client, "error").get(2).get("data").get("message").asText());

        // still usable
        client.send("{\"type\":\"cursor.update\",\"cursor\":\"c-9\"}");
        assertEquals("c-9", awaitFrame(client, "cursor.updated").get("data").get("cursor").asText());
    }

    @Test
    void testSubscribeUnsubscribe() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=test-token-carol"));
        awaitFrame(client, "connection.established");

        client.send("{\"type\":\"subscribe\",\"topics\":[\"contact.*\",\"account.*\"]}");
        JsonNode confirmed = awaitFrame(client, "subscription.confirmed");
        assertEquals(2, confirmed.get("data").get("topics").size());

        client.send("{\"type\":\"unsubscribe\",\"topics\":[]}");
        JsonNode unsubscribed = awaitFrame(client, "unsubscription.confirmed");
        assertTrue(unsubscribed.get("data").get("all").asBoolean());
        assertEquals(2, unsubscribed.get("data").get("topics").size());
    }

    @Test
    void testUnsubscribeValidation() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=test-token-oscar"));
        awaitFrame(client, "connection.established");
        client.send("{\"type\":\"subscribe\",\"topics\":[\"deal.*\"]}");
        awaitFrame(client, "subscription.confirmed");

        client.send("{\"type\":\"unsubscribe\",\"topics\":[\"invoice.*\"]}");
        JsonNode error = awaitFrame(client, "error");
        assertEquals("validation", error.get("data").get("category").asText());
        assertEquals("invoice.*", error.get("data").get("rejected").get(0).asText());

        client.send("{\"type\":\"unsubscribe\",\"topics\":[null]}");
        Awaitility.await().until(() -> frames(client, "error").size() == 2);
        assertEquals(
                "validation", frames(client, "error").get(1).get("data").get("category").asText());

        assertTrue(frames(client, "unsubscription.confirmed").isEmpty());

        // the rejected requests left the subscription in place
        client.send("{\"type\":\"unsubscribe\",\"topics\":[]}");
        JsonNode unsubscribed = awaitFrame(client, "unsubscription.confirmed");
        assertTrue(unsubscribed.get("data").get("all").asBoolean());
        assertEquals(1, unsubscribed.get("data").get("topics").size());
        assertEquals("deal.*", unsubscribed.get("data").get("topics").get(0).asText());
    }

    @Test
    void testRegistryReturnsToZeroAfterDisconnect() throws Exception {
        for (int i = 0; i < 5; i++) {
            TestWebSocketClient client =
                    new TestWebSocketClient().connect(wsUri("token=test-token-user" + i));
            awaitFrame(client, "connection.established");
            client.send("{\"type\":\"subscribe\",\"topics\":[\"activity.*\",\"activity.call." + i + "\"]}");
            awaitFrame(client, "subscription.confirmed");
            client.close();
        }
        Awaitility.await()
                .untilAsserted(
                        () -> {
                            assertEquals(0, registry.liveEntryCount());
                            assertEquals(0, connectionManager.size());
                        });
    }

    @Test
    void testEventReachesWebSocketAndLongPollOnce() throws Exception {
        @Cleanup
        TestWebSocketClient client =
                new TestWebSocketClient().connect(wsUri("token=test-token-dave"));
        awaitFrame(client, "connection.established");
        client.send("{\"type\":\"subscribe\",\"topics\":[\"deal.stage.*\"]}");
        awaitFrame(client, "subscription.confirmed");

        HttpRequest pollRequest =
                HttpRequest.newBuilder(
                                URI.create(
                                        "http://localhost:%d/poll?topics=deal.stage.*&timeout=20"
                                                .formatted(port)))
                        .header("Authorization", "Bearer test-token-erin")
                        .GET()
                        .build();
        CompletableFuture<HttpResponse<String>> poll =
                CLIENT.sendAsync(pollRequest, HttpResponse.BodyHandlers.ofString());
        // the poll waiter is registered next to the websocket entry
        Event sample =
                Event.builder()
                        .eventId("sample")
                        .eventType("deal.stage.updated")
                        .timestamp(Instant.now())
                        .build();
        Awaitility.await().until(() -> registry.resolve(sample).size() == 2);

        assertTrue(
                eventBus.publishEvent(
                        "deal.stage.updated", Map.of("deal_id", 42), "us-east-1", null, null));

        JsonNode event = awaitFrame(client, "event");
        assertEquals("deal.stage.updated", event.get("data").get("event_type").asText());
        assertEquals(42, event.get("data").get("data").get("deal_id").asInt());
        assertEquals("us-east-1", event.get("data").get("metadata").get("region").asText());

        HttpResponse<String> response = poll.get(10, TimeUnit.SECONDS);
        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals(1, body.get("events").size());
        assertEquals(
                event.get("data").get("event_id").asText(),
                body.get("events").get(0).get("event_id").asText());
        assertEquals(
                event.get("data").get("event_id").asText(), body.get("cursor").asText());
        assertFalse(body.get("has_more").asBoolean());

        Thread.sleep(300);
        assertEquals(1, frames(client, "event").size());
    }
}
