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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KafkaBackendConfigurationTest {

    @Test
    void testDefaults() {
        KafkaBackendConfiguration config = KafkaBackendConfiguration.fromMap(Map.of());
        assertEquals("crm-events", config.topic());
        assertTrue(config.createTopic());
        assertEquals(1, config.partitions());
        assertEquals(Duration.ofSeconds(5), config.publishTimeout());
        assertEquals(Map.of("bootstrap.servers", "localhost:9092"), config.kafkaConfig());
    }

    @Test
    void testClientSettingsArePassedThrough() {
        KafkaBackendConfiguration config =
                KafkaBackendConfiguration.fromMap(
                        Map.of(
                                "topic", "tenant-events",
                                "create-topic", false,
                                "partitions", 6,
                                "bootstrap.servers", "kafka:9092",
                                "security.protocol", "SASL_SSL"));
        assertEquals("tenant-events", config.topic());
        assertFalse(config.createTopic());
        assertEquals(6, config.partitions());
        assertEquals(
                Map.of("bootstrap.servers", "kafka:9092", "security.protocol", "SASL_SSL"),
                config.kafkaConfig());
    }
}
