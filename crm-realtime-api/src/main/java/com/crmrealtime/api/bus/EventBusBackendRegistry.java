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
package com.crmrealtime.api.bus;

import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import lombok.extern.slf4j.Slf4j;

/** Resolves the configured backend type to an implementation found on the classpath. */
@Slf4j
public final class EventBusBackendRegistry {

    private EventBusBackendRegistry() {}

    public static EventBusBackend loadBackend(String type, Map<String, Object> configuration) {
        return loadBackend(type, configuration, EventBusBackendRegistry.class.getClassLoader());
    }

    public static EventBusBackend loadBackend(
            String type, Map<String, Object> configuration, ClassLoader classLoader) {
        Objects.requireNonNull(type, "type cannot be null");
        final Map<String, Object> config = configuration == null ? Map.of() : configuration;
        log.info("Loading event bus backend for type {}", type);
        final EventBusBackendProvider provider =
                ServiceLoader.load(EventBusBackendProvider.class, classLoader).stream()
                        .map(ServiceLoader.Provider::get)
                        .filter(p -> p.supports(type))
                        .findFirst()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "No EventBusBackendProvider found for type "
                                                        + type));
        log.info("Event bus backend {} provided by {}", type, provider.getClass().getName());
        return provider.createBackend(config);
    }
}
