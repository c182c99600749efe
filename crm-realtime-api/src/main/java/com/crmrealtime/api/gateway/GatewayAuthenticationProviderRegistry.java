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
package com.crmrealtime.api.gateway;

import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

public class GatewayAuthenticationProviderRegistry {

    private GatewayAuthenticationProviderRegistry() {}

    public static GatewayAuthenticationProvider loadProvider(
            String type, Map<String, Object> configuration) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        final GatewayAuthenticationProvider provider =
                ServiceLoader.load(GatewayAuthenticationProvider.class).stream()
                        .map(ServiceLoader.Provider::get)
                        .filter(p -> type.equals(p.type()))
                        .findFirst()
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "No GatewayAuthenticationProvider found for type "
                                                        + type));
        provider.initialize(configuration);
        return provider;
    }
}
