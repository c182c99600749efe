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
package com.crmrealtime.kafka.runtime;

import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusBackendProvider;
import java.util.Map;

public class KafkaEventBusBackendProvider implements EventBusBackendProvider {

    @Override
    public boolean supports(String type) {
        return "kafka".equals(type);
    }

    @Override
    public EventBusBackend createBackend(Map<String, Object> configuration) {
        return new KafkaEventBusBackend(KafkaBackendConfiguration.fromMap(configuration));
    }
}
