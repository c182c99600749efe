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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings of the {@code kafka} backend. Keys other than the ones below are passed to the Kafka
 * clients unchanged ({@code bootstrap.servers}, security settings...).
 */
public record KafkaBackendConfiguration(
        String topic,
        boolean createTopic,
        int partitions,
        short replicationFactor,
        Duration publishTimeout,
        Duration pollTimeout,
        Map<String, Object> kafkaConfig) {

    public static final String DEFAULT_TOPIC = "crm-events";

    static final String TOPIC = "topic";
    static final String CREATE_TOPIC = "create-topic";
    static final String PARTITIONS = "partitions";
    static final String REPLICATION_FACTOR = "replication-factor";
    static final String PUBLISH_TIMEOUT_MS = "publish-timeout-ms";
    static final String POLL_TIMEOUT_MS = "poll-timeout-ms";

    public static KafkaBackendConfiguration fromMap(Map<String, Object> configuration) {
        final Map<String, Object> kafkaConfig = new HashMap<>(configuration);
        final String topic = stringValue(kafkaConfig.remove(TOPIC), DEFAULT_TOPIC);
        final boolean createTopic =
                Boolean.parseBoolean(stringValue(kafkaConfig.remove(CREATE_TOPIC), "true"));
        final int partitions = Integer.parseInt(stringValue(kafkaConfig.remove(PARTITIONS), "1"));
        final short replicationFactor =
                Short.parseShort(stringValue(kafkaConfig.remove(REPLICATION_FACTOR), "1"));
        final long publishTimeout =
                Long.parseLong(stringValue(kafkaConfig.remove(PUBLISH_TIMEOUT_MS), "5000"));
        final long pollTimeout =
                Long.parseLong(stringValue(kafkaConfig.remove(POLL_TIMEOUT_MS), "500"));
        kafkaConfig.putIfAbsent("bootstrap.servers", "localhost:9092");
        return new KafkaBackendConfiguration(
                topic,
                createTopic,
                partitions,
                replicationFactor,
                Duration.ofMillis(publishTimeout),
                Duration.ofMillis(pollTimeout),
                Map.copyOf(kafkaConfig));
    }

    private static String stringValue(Object value, String defaultValue) {
        return value == null ? defaultValue : value.toString();
    }
}
