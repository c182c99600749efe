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
package com.crmrealtime.gateway;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

/** Startup banner with the endpoints the gateway listens on. */
final class ApplicationStartupTraces {

    private static final String SEPARATOR = "-".repeat(58);
    private static final String BREAK = "\n";
    private static final String SPACER = "  ";

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartupTraces.class);

    private ApplicationStartupTraces() {}

    static String of(Environment environment) {
        Objects.requireNonNull(environment, "Environment must not be null");

        final StringBuilder trace = new StringBuilder(BREAK);
        line(trace, SEPARATOR);
        line(trace, runningTrace(environment));
        final String port = environment.getProperty("server.port");
        if (StringUtils.isNotBlank(port)) {
            line(trace, "Local: \t\thttp://localhost:%s".formatted(port));
            line(trace, "External: \thttp://%s:%s".formatted(hostAddress(), port));
            line(trace, "WebSocket: \tws://localhost:%s/ws".formatted(port));
            line(trace, "Long-poll: \thttp://localhost:%s/poll".formatted(port));
        }
        line(
                trace,
                "Event bus: \t%s"
                        .formatted(
                                environment.getProperty(
                                        "application.gateway.event-bus.type", "memory")));
        final String[] profiles = environment.getActiveProfiles();
        if (ArrayUtils.isNotEmpty(profiles)) {
            line(trace, "Profile(s): \t%s".formatted(String.join(", ", profiles)));
        }
        line(trace, SEPARATOR);
        return trace.toString();
    }

    private static void line(StringBuilder trace, String line) {
        trace.append(SPACER).append(line).append(BREAK);
    }

    private static String runningTrace(Environment environment) {
        final String applicationId = environment.getProperty("spring.application.name");
        if (StringUtils.isBlank(applicationId)) {
            return "Application is running!";
        }
        return "Application '%s' is running!".formatted(applicationId);
    }

    private static String hostAddress() {
        try {
            return InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("The host name could not be determined, using `localhost` as fallback");
        }
        return "localhost";
    }
}
