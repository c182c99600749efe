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
package com.crmrealtime.auth.jwt;

import com.crmrealtime.api.gateway.GatewayAuthenticationProvider;
import com.crmrealtime.api.gateway.GatewayAuthenticationResult;
import com.crmrealtime.api.gateway.GatewayRequestContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

/** Verifies bearer JWTs and exposes the user, tenant and email claims as principal values. */
@Slf4j
public class JwtAuthenticationProvider implements GatewayAuthenticationProvider {

    private static final ObjectMapper mapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private AuthenticationProviderToken authenticationProviderToken;

    record Configuration(
            @JsonProperty("secret-key") String secretKey,
            @JsonProperty("public-key") String publicKey,
            @JsonProperty("auth-claim") String authClaim,
            @JsonProperty("public-alg") String publicAlg,
            @JsonProperty("audience-claim") String audienceClaim,
            @JsonProperty("audience") String audience,
            @JsonProperty("company-claim") String companyClaim) {}

    @Override
    public String type() {
        return "jwt";
    }

    @Override
    @SneakyThrows
    public void initialize(Map<String, Object> configuration) {
        final Configuration config = mapper.convertValue(configuration, Configuration.class);
        final JwtProperties jwtProperties =
                new JwtProperties(
                        config.secretKey(),
                        config.publicKey(),
                        config.authClaim(),
                        config.publicAlg(),
                        config.audienceClaim(),
                        config.audience(),
                        config.companyClaim());
        this.authenticationProviderToken = new AuthenticationProviderToken(jwtProperties);
    }

    @Override
    public GatewayAuthenticationResult authenticate(GatewayRequestContext context) {
        final TokenPrincipal principal;
        try {
            principal = authenticationProviderToken.authenticate(context.credentials());
        } catch (AuthenticationProviderToken.AuthenticationException ex) {
            log.debug("Rejected token: {}", ex.getMessage());
            return GatewayAuthenticationResult.authenticationFailed(ex.getMessage());
        }
        final Map<String, String> values = new HashMap<>();
        values.put(GatewayAuthenticationResult.USER_ID, principal.userId());
        if (principal.companyId() != null) {
            values.put(GatewayAuthenticationResult.COMPANY_ID, principal.companyId());
        }
        if (principal.email() != null) {
            values.put(GatewayAuthenticationResult.EMAIL, principal.email());
        }
        return GatewayAuthenticationResult.authenticationSuccessful(values);
    }
}
