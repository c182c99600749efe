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

import com.crmrealtime.api.events.GdprContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record PublishRequest(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("data") Map<String, Object> data,
        @JsonProperty("region") String region,
        @JsonProperty("gdpr_context") GdprContext gdprContext,
        @JsonProperty("idempotency_key") String idempotencyKey) {}
