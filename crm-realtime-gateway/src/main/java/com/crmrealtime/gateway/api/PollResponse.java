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
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Body of a long-poll reply.
 *
 * <p>{@code has_more} is true when the batch was cut at the maximum batch size: more matching
 * events may follow right away, so the client should poll again without delay. Events are never
 * buffered between polls, so nothing published before the next poll can be fetched later.
 */
public record PollResponse(
        @JsonProperty("events") List<Event> events,
        @JsonProperty("cursor") String cursor,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("has_more") boolean hasMore) {}
