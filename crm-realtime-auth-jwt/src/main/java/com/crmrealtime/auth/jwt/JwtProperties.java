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

/**
 * Token verification settings. Keys may be given inline as base64, as a path on disk, or as a
 * {@code data:} or {@code file:} URL.
 */
public record JwtProperties(
        String secretKey,
        String publicKey,
        String authClaim,
        String publicAlg,
        String audienceClaim,
        String audience,
        String companyClaim) {}
