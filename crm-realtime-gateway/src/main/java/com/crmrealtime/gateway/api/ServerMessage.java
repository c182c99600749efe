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
package com.crmrealtime.gateway.api;

import com.crmrealtime.api.events.Event;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Frame pushed to a WebSocket client: a type and a payload. */
public record ServerMessage(String type, Object data) {

    public static final String CONNECTION_ESTABLISHED = "connection.established";
    public static final String SUBSCRIPTION_CONFIRMED = "subscription.confirmed";
    public static final String UNSUBSCRIPTION_CONFIRMED = "unsubscription.confirmed";
    public static final String CURSOR_UPDATED = "cursor.updated";
    public static final String PONG = "pong";
    public static final String ERROR = "error";
    public static final String EVENT = "event";

    public static final String CATEGORY_VALIDATION = "validation";
    public static final String CATEGORY_INTERNAL = "internal";

    public static ServerMessage connectionEstablished(
            String connectionId, String userId, String companyId, Instant serverTime) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("connection_id", connectionId);
        data.put("user_id", userId);
        data.put("company_id", companyId);
        data.put("server_time", serverTime.toString());
        return new ServerMessage(CONNECTION_ESTABLISHED, data);
    }

    public static ServerMessage subscriptionConfirmed(List<String> topics, Instant now) {
        return new ServerMessage(
                SUBSCRIPTION_CONFIRMED, Map.of("topics", topics, "timestamp", now.toString()));
    }

    public static ServerMessage unsubscriptionConfirmed(
            List<String> topics, boolean all, Instant now) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("topics", topics);
        if (all) {
            data.put("all", true);
        }
        data.put("timestamp", now.toString());
        return new ServerMessage(UNSUBSCRIPTION_CONFIRMED, data);
    }

    public static ServerMessage cursorUpdated(String cursor, Instant now) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("cursor", cursor);
        data.put("timestamp", now.toString());
        return new ServerMessage(CURSOR_UPDATED, data);
    }

    public static ServerMessage pong(Instant now) {
        return new ServerMessage(PONG, Map.of("timestamp", now.toString()));
    }

    public static ServerMessage error(
            String category, String message, List<String> rejected, Instant now) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("category", category);
        data.put("message", message);
        if (rejected != null && !rejected.isEmpty()) {
            data.put("rejected", rejected);
        }
        data.put("timestamp", now.toString());
        return new ServerMessage(ERROR, data);
    }

    public static ServerMessage event(Event event) {
        return new ServerMessage(EVENT, event);
    }
}
