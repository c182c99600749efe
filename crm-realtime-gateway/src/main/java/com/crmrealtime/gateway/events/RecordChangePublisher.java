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

import com.crmrealtime.api.events.GdprContext;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes {@code <app>.<model>.<action>} events for record changes made by the business
 * application. Never throws: a failed publish must not break the change that triggered it.
 */
@Slf4j
public class RecordChangePublisher {

    public static final String CREATED = "created";
    public static final String UPDATED = "updated";
    public static final String DELETED = "deleted";

    private final EventBus eventBus;

    public RecordChangePublisher(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public boolean publish(
            String app,
            String model,
            String action,
            Object id,
            Object companyId,
            Object ownerId,
            Map<String, Object> extra) {
        final String eventType = "%s.%s.%s".formatted(app, model, action);
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", id);
        data.put("model", model);
        data.put("app", app);
        if (companyId != null) {
            data.put("company_id", companyId);
        }
        if (ownerId != null) {
            data.put("owner_id", ownerId);
        }
        if (extra != null) {
            data.putAll(extra);
        }
        final GdprContext gdprContext =
                GdprContext.builder()
                        .consent(true)
                        .retentionDays(eventBus.defaultRetentionDays())
                        .build();
        try {
            return eventBus.publishEvent(eventType, data, null, gdprContext, null);
        } catch (Exception e) {
            log.error("Failed to publish record change event_type={} id={}", eventType, id, e);
            return false;
        }
    }
}
