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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.crmrealtime.api.gateway.GatewayAuthenticationProvider;
import com.crmrealtime.api.gateway.GatewayAuthenticationResult;
import com.crmrealtime.gateway.errors.AuthenticationException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class GatewayRequestHandlerTest {

    private final GatewayRequestHandler handler =
            new GatewayRequestHandler(new TestGatewayAuthenticationProvider());

    @Test
    void testAuthenticate() throws Exception {
        AuthenticatedContext context = handler.authenticate("test-token-alice", null, Map.of());
        assertEquals("alice", context.userId());
        assertNull(context.companyId());
        assertEquals("alice@crm.test", context.email());
    }

    @Test
    void testCompanyFromTokenOrRequest() throws Exception {
        assertEquals(
                "acme", handler.authenticate("test-token-alice@acme", null, Map.of()).companyId());
        assertEquals(
                "acme",
                handler.authenticate("test-token-alice@acme", "acme", Map.of()).companyId());
        assertEquals(
                "globex", handler.authenticate("test-token-bob", "globex", Map.of()).companyId());
    }

    @Test
    void testCompanyMismatch() {
        AuthenticationException e =
                assertThrows(
                        AuthenticationException.class,
                        () -> handler.authenticate("test-token-alice@acme", "globex", Map.of()));
        assertEquals("company_id does not match credentials", e.getMessage());
    }

    @Test
    void testMissingOrInvalidCredentials() {
        assertEquals(
                "Missing credentials",
                assertThrows(
                                AuthenticationException.class,
                                () -> handler.authenticate(" ", null, Map.of()))
                        .getMessage());
        assertEquals(
                "Invalid credentials",
                assertThrows(
                                AuthenticationException.class,
                                () -> handler.authenticate("secret", null, null))
                        .getMessage());
    }

    @Test
    void testProviderFailures() {
        GatewayAuthenticationProvider provider = Mockito.mock(GatewayAuthenticationProvider.class);
        GatewayRequestHandler failing = new GatewayRequestHandler(provider);

        Mockito.when(provider.authenticate(Mockito.any()))
                .thenThrow(new IllegalStateException("boom"));
        assertEquals(
                "Authentication failed",
                assertThrows(
                                AuthenticationException.class,
                                () -> failing.authenticate("token", null, Map.of()))
                        .getMessage());

        Mockito.reset(provider);
        Mockito.when(provider.authenticate(Mockito.any()))
                .thenReturn(
                        GatewayAuthenticationResult.authenticationSuccessful(
                                Map.of(GatewayAuthenticationResult.EMAIL, "a@b.c")));
        assertEquals(
                "No user found in credentials",
                assertThrows(
                                AuthenticationException.class,
                                () -> failing.authenticate("token", null, Map.of()))
                        .getMessage());
    }
}
