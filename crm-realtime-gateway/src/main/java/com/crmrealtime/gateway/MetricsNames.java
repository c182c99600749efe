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
package com.crmrealtime.gateway;

public class MetricsNames {
    public static final String EVENTS_PUBLISHED = "crm.realtime.events.published";
    public static final String EVENTS_DELIVERED = "crm.realtime.events.delivered";
    public static final String EVENTS_DROPPED = "crm.realtime.events.dropped";
    public static final String DELIVERY_LATENCY = "crm.realtime.delivery.latency";
    public static final String WEBSOCKET_CONNECTIONS = "crm.realtime.websocket.connections";
    public static final String WEBSOCKET_ERRORS = "crm.realtime.websocket.errors";
    public static final String LONGPOLL_REQUESTS = "crm.realtime.longpoll.requests";
    public static final String SUBSCRIPTION_ENTRIES = "crm.realtime.subscriptions.entries";
}
