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
package com.crmrealtime.gateway.auth;

import com.crmrealtime.api.gateway.GatewayAuthenticationProvider;
import com.crmrealtime.api.gateway.GatewayAuthenticationResult;
import com.crmrealtime.api.gateway.GatewayRequestContext;
import com.crmrealtime.gateway.errors.AuthenticationException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Authenticates WebSocket handshakes and HTTP requests with the configured provider. */
@Slf4j
public class GatewayRequestHandler {

    private final GatewayAuthenticationProvider authProvider;

    public GatewayRequestHandler(GatewayAuthenticationProvider authProvider) {
        this.authProvider = authProvider;
        log.info("Using authentication provider {}", authProvider.getClass().getName());
    }

    /**
     * @param companyId tenant requested by the client, checked against the tenant claim when the
     *     token carries one
     */
    public AuthenticatedContext authenticate(
            String credentials, String companyId, Map<String, String> httpHeaders)
            throws AuthenticationException {
        if (StringUtils.isBlank(credentials)) {
            throw new AuthenticationException("Missing credentials");
        }
        final String requestedCompany = StringUtils.trimToNull(companyId);
        final GatewayRequestContext context =
                GatewayRequestContextImpl.builder()
                        .credentials(credentials)
                        .companyId(requestedCompany)
                        .httpHeaders(httpHeaders == null ? Map.of() : httpHeaders)
                        .build();
        final GatewayAuthenticationResult result;
        try {
            result = authProvider.authenticate(context);
        } catch (RuntimeException e) {
            log.error("Authentication provider failed", e);
            throw new AuthenticationException("Authentication failed");
        }
        if (result == null || !result.authenticated()) {
            final String reason = result == null ? null : result.reason();
            throw new AuthenticationException(StringUtils.defaultIfBlank(reason, "unknown"));
        }
        final Map<String, String> principal = result.principalValues();
        final String userId = principal.get(GatewayAuthenticationResult.USER_ID);
        if (StringUtils.isBlank(userId)) {
            throw new AuthenticationException("No user found in credentials");
        }
        final String tokenCompany = principal.get(GatewayAuthenticationResult.COMPANY_ID);
        if (requestedCompany != null
                && tokenCompany != null
                && !requestedCompany.equals(tokenCompany)) {
            throw new AuthenticationException("company_id does not match credentials");
        }
        return new AuthenticatedContext(
                userId,
                requestedCompany != null ? requestedCompany : tokenCompany,
                principal.get(GatewayAuthenticationResult.EMAIL));
    }
}
