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
package com.crmrealtime.redis.runtime;

import com.crmrealtime.api.bus.EventBusBackend;
import com.crmrealtime.api.bus.EventBusBackendProvider;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

@Slf4j
public class RedisEventBusBackendProvider implements EventBusBackendProvider {

    static final String ADDRESS = "address";
    static final String PASSWORD = "password";
    static final String DATABASE = "database";
    static final String TIMEOUT_MS = "timeout-ms";
    static final String DEFAULT_ADDRESS = "redis://localhost:6379";

    @Override
    public boolean supports(String type) {
        return "redis".equals(type);
    }

    @Override
    public EventBusBackend createBackend(Map<String, Object> configuration) {
        log.info(
                "Connecting to Redis at {}", configuration.getOrDefault(ADDRESS, DEFAULT_ADDRESS));
        return new RedisEventBusBackend(Redisson.create(toRedissonConfig(configuration)), true);
    }

    static Config toRedissonConfig(Map<String, Object> configuration) {
        final Config config = new Config();
        final SingleServerConfig server =
                config.useSingleServer()
                        .setAddress(
                                configuration.getOrDefault(ADDRESS, DEFAULT_ADDRESS).toString());
        final Object password = configuration.get(PASSWORD);
        if (password != null) {
            server.setPassword(password.toString());
        }
        final Object database = configuration.get(DATABASE);
        if (database != null) {
            server.setDatabase(Integer.parseInt(database.toString()));
        }
        final Object timeout = configuration.get(TIMEOUT_MS);
        if (timeout != null) {
            server.setTimeout(Integer.parseInt(timeout.toString()));
        }
        return config;
    }
}
