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

public record GatewayAuthenticationResult(
        boolean authenticated, String reason, Map<String, String> principalValues) {

    public static final String USER_ID = "user_id";
    public static final String COMPANY_ID = "company_id";
    public static final String EMAIL = "email";

    public static GatewayAuthenticationResult authenticationSuccessful(
            Map<String, String> principalValues) {
        return new GatewayAuthenticationResult(true, null, Map.copyOf(principalValues));
    }

    public static GatewayAuthenticationResult authenticationFailed(String reason) {
        return new GatewayAuthenticationResult(false, reason, Map.of());
    }
}
