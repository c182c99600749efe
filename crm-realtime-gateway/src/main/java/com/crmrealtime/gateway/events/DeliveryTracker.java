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

import com.crmrealtime.api.events.Event;
import com.crmrealtime.api.events.EventMetadata;
import com.crmrealtime.api.events.GdprContext;
import com.crmrealtime.api.topics.TopicPattern;
import com.crmrealtime.gateway.errors.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates publish calls and stamps the envelope with its identity and delivery metadata.
 *
 * <p>Delivery is at-least-once: the tracker keeps no history, a retry carrying the same
 * idempotency key is published again and deduplication is left to consumers.
 */
public class DeliveryTracker {

    private final String defaultRegion;
    private final int defaultRetentionDays;
    private final Supplier<String> idGenerator;

    public DeliveryTracker(String defaultRegion, int defaultRetentionDays) {
        this(defaultRegion, defaultRetentionDays, () -> UUID.randomUUID().toString());
    }

    DeliveryTracker(
            String defaultRegion, int defaultRetentionDays, Supplier<String> idGenerator) {
        this.defaultRegion = defaultRegion;
        this.defaultRetentionDays = defaultRetentionDays;
        this.idGenerator = idGenerator;
    }

    public Event prepare(
            String eventType,
            Map<String, Object> data,
            Instant timestamp,
            String region,
            GdprContext gdprContext,
            String idempotencyKey) {
        if (StringUtils.isBlank(eventType)) {
            throw new ValidationException("event_type is required");
        }
        if (!TopicPattern.isWellFormedEventType(eventType)) {
            throw new ValidationException(
                    "Malformed event_type: " + eventType, List.of(eventType));
        }
        if (timestamp == null) {
            throw new ValidationException("timestamp is required");
        }
        final String eventId = idGenerator.get();
        return Event.builder()
                .eventId(eventId)
                .eventType(eventType)
                .timestamp(timestamp)
                .data(data)
                .metadata(
                        EventMetadata.builder()
                                .region(StringUtils.defaultIfBlank(region, defaultRegion))
                                .idempotencyKey(
                                        StringUtils.defaultIfBlank(idempotencyKey, eventId))
                                .gdprContext(
                                        gdprContext != null
                                                ? gdprContext
                                                : GdprContext.withRetentionDays(
                                                        defaultRetentionDays))
                                .build())
                .build();
    }

    public int defaultRetentionDays() {
        return defaultRetentionDays;
    }
}
