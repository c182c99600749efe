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
package com.crmrealtime.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "application.gateway")
@Validated
@Data
@NoArgsConstructor
public class GatewayProperties {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventBusProperties {
        @NotBlank private String type = "memory";
        @NotBlank private String channelPrefix = "crm.events";
        private Map<String, Object> configuration = new HashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DefaultsProperties {
        @NotBlank private String region = "us-east-1";
        @Min(1)
        private int retentionDays = 365;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PollProperties {
        @Min(1)
        private int defaultTimeoutSeconds = 30;

        @Min(1)
        private int maxTimeoutSeconds = 60;

        @Min(1)
        private int maxBatchSize = 100;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WebSocketProperties {
        @Min(1)
        private int outboundQueueSize = 256;

        @Min(1)
        private int idleTimeoutSeconds = 120;

        @Min(1)
        private int idleCheckIntervalSeconds = 10;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopicsProperties {
        @NotEmpty
        private List<String> allowedPrefixes =
                new ArrayList<>(List.of("deal.", "timeline.", "activity.", "contact.", "account."));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthenticationProperties {
        @NotBlank private String type = "jwt";
        private Map<String, Object> configuration = new HashMap<>();
    }

    @Valid private EventBusProperties eventBus = new EventBusProperties();
    @Valid private DefaultsProperties defaults = new DefaultsProperties();
    @Valid private PollProperties poll = new PollProperties();
    @Valid private WebSocketProperties websocket = new WebSocketProperties();
    @Valid private TopicsProperties topics = new TopicsProperties();
    @Valid private AuthenticationProperties authentication = new AuthenticationProperties();
}
