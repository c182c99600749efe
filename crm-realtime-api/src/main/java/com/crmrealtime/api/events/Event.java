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
package com.crmrealtime.api.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * The canonical event envelope. Instances are immutable once built and can be shared freely
 * between threads; retries re-publish a new envelope carrying the same idempotency key.
 */
@Builder(toBuilder = true)
public record Event(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("metadata") EventMetadata metadata) {

    public static final String COMPANY_ID_FIELD = "company_id";

    public Event {
        Objects.requireNonNull(eventId, "eventId cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        data =
                data == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        metadata = metadata == null ? EventMetadata.builder().build() : metadata;
    }

    /** Tenant scope carried by the payload, if the publisher set one. */
    @JsonIgnore
    public String companyId() {
        final Object value = data.get(COMPANY_ID_FIELD);
        return value == null ? null : value.toString();
    }

    @JsonIgnore
    public String idempotencyKey() {
        return metadata.idempotencyKey();
    }
}
