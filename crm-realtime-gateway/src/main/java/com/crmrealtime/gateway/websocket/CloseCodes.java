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
package com.crmrealtime.gateway.websocket;

import org.springframework.web.socket.CloseStatus;

public final class CloseCodes {

    public static final int INTERNAL_ERROR_CODE = 4000;
    public static final int AUTHENTICATION_FAILED_CODE = 4001;
    public static final int SLOW_CONSUMER_CODE = 4008;

    public static final CloseStatus SLOW_CONSUMER =
            new CloseStatus(SLOW_CONSUMER_CODE, "slow consumer");
    public static final CloseStatus IDLE_TIMEOUT = CloseStatus.GOING_AWAY.withReason("idle timeout");
    public static final CloseStatus INTERNAL_ERROR =
            new CloseStatus(INTERNAL_ERROR_CODE, "Connection error");

    private CloseCodes() {}

    public static CloseStatus authenticationFailed(String reason) {
        return new CloseStatus(AUTHENTICATION_FAILED_CODE, truncate(reason));
    }

    // close reasons are limited to 123 bytes
    private static String truncate(String reason) {
        if (reason == null) {
            return "Authentication failed";
        }
        return reason.length() > 100 ? reason.substring(0, 100) : reason;
    }
}
