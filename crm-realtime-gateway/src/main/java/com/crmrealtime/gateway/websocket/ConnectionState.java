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

import java.util.Set;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    ACTIVE,
    CLOSING,
    CLOSED,
    REJECTED;

    boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> Set.of(AUTHENTICATING, CLOSING, CLOSED).contains(next);
            case AUTHENTICATING -> Set.of(ACTIVE, REJECTED, CLOSING, CLOSED).contains(next);
            case ACTIVE -> Set.of(CLOSING, CLOSED).contains(next);
            case CLOSING -> next == CLOSED;
            case CLOSED, REJECTED -> false;
        };
    }
}
