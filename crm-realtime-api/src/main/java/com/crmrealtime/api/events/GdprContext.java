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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Compliance metadata attached by the publisher. The gateway only carries it along: retention
 * and consent are enforced by downstream consumers.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GdprContext(
        @JsonProperty("consent") Boolean consent,
        @JsonProperty("purpose") String purpose,
        @JsonProperty("retention_days") Integer retentionDays,
        @JsonProperty("data_subject_id") String dataSubjectId) {

    public static GdprContext withRetentionDays(int retentionDays) {
        return GdprContext.builder().retentionDays(retentionDays).build();
    }
}
