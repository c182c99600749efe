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
package com.crmrealtime.gateway.subscriptions;

import com.crmrealtime.api.events.Event;

/** A WebSocket connection or a pending long-poll request. */
public interface Subscriber {

    String id();

    /** Tenant the subscriber is scoped to, or null when it is not scoped. */
    String companyId();

    /** Called from the dispatch thread. Must not block. */
    void deliver(Event event);
}
