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
package com.crmrealtime.kafka.extensions;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.utility.DockerImageName;

@Slf4j
public class KafkaContainerExtension implements BeforeAllCallback, AfterAllCallback {
    private KafkaContainer kafkaContainer;

    @Override
    public void afterAll(ExtensionContext extensionContext) {
        if (kafkaContainer != null) {
            kafkaContainer.close();
        }
    }

    @Override
    public void beforeAll(ExtensionContext extensionContext) {
        Assumptions.assumeTrue(
                DockerClientFactory.instance().isDockerAvailable(), "Docker is not available");
        kafkaContainer =
                new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.4.0"))
                        .withLogConsumer(
                                outputFrame ->
                                        log.debug("kafka> {}", outputFrame.getUtf8String().trim()));
        kafkaContainer.start();
    }

    public String getBootstrapServers() {
        return kafkaContainer.getBootstrapServers();
    }
}
