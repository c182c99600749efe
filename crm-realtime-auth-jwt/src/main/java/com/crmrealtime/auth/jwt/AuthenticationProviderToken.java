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

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.RequiredTypeException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.Key;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.List;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class AuthenticationProviderToken {

    public static final String DEFAULT_AUTH_CLAIM = "sub";
    public static final String DEFAULT_COMPANY_CLAIM = "company_id";
    public static final String EMAIL_CLAIM = "email";

    public static final class AuthenticationException extends Exception {

        public AuthenticationException(String message) {
            super(message);
        }
    }

    private final JwtParser parser;
    private final String authClaim;
    private final String companyClaim;
    private final String audienceClaim;
    private final String audience;

    public AuthenticationProviderToken(JwtProperties tokenProperties)
            throws IOException, IllegalArgumentException {
        final Key validationKey =
                getValidationKeyFromConfig(tokenProperties, getPublicKeyAlgType(tokenProperties));
        if (validationKey == null) {
            throw new IllegalArgumentException("Either secret-key or public-key must be set");
        }
        parser = Jwts.parserBuilder().setSigningKey(validationKey).build();
        this.authClaim = defaultIfBlank(tokenProperties.authClaim(), DEFAULT_AUTH_CLAIM);
        this.companyClaim = defaultIfBlank(tokenProperties.companyClaim(), DEFAULT_COMPANY_CLAIM);
        this.audienceClaim = StringUtils.trimToNull(tokenProperties.audienceClaim());
        this.audience = StringUtils.trimToNull(tokenProperties.audience());

        if (this.audienceClaim != null && this.audience == null) {
            throw new IllegalArgumentException(
                    "Token Audience Claim ["
                            + this.audienceClaim
                            + "] configured, but no audience is set for this gateway.");
        }
    }

    public TokenPrincipal authenticate(String token) throws AuthenticationException {
        if (StringUtils.isBlank(token)) {
            throw new AuthenticationException("Missing token");
        }
        final Claims claims = authenticateToken(token).getBody();
        log.debug("Token body: {}", claims);
        final String principal = getStringClaim(claims, authClaim);
        if (principal == null) {
            throw new AuthenticationException("Token was valid, however no principal found.");
        }
        return new TokenPrincipal(
                principal, getStringClaim(claims, companyClaim), getStringClaim(claims, EMAIL_CLAIM));
    }

    private Jws<Claims> authenticateToken(final String token) throws AuthenticationException {
        try {
            final Jws<Claims> jwt = parser.parseClaimsJws(token);
            if (this.audienceClaim != null) {
                checkAudience(jwt.getBody().get(this.audienceClaim));
            }
            return jwt;
        } catch (JwtException | IllegalArgumentException ex) {
            throw new AuthenticationException("Failed to authenticate token: " + ex.getMessage());
        }
    }

    private void checkAudience(Object object) throws AuthenticationException {
        if (object == null) {
            throw new AuthenticationException(
                    "Found null Audience in token, for claimed field: " + this.audienceClaim);
        }
        if (object instanceof List<?> audiences) {
            if (audiences.stream().noneMatch(this.audience::equals)) {
                throw new AuthenticationException(
                        "Audiences in token: " + audiences + " do not contain " + this.audience);
            }
        } else if (!(object instanceof String)) {
            throw new AuthenticationException(
                    "Audiences in token is not in expected format: " + object);
        } else if (!object.equals(this.audience)) {
            throw new AuthenticationException(
                    "Audience in token: [" + object + "] does not match " + this.audience);
        }
    }

    private static String getStringClaim(Claims body, String claim) {
        final Object value = body.get(claim);
        if (value == null) {
            return null;
        }
        try {
            return body.get(claim, String.class);
        } catch (RequiredTypeException e) {
            if (value instanceof List<?> list) {
                return !list.isEmpty() && list.get(0) != null ? list.get(0).toString() : null;
            }
            // numeric ids
            return value.toString();
        }
    }

    private static Key getValidationKeyFromConfig(
            JwtProperties tokenProperties, SignatureAlgorithm algType) throws IOException {
        final String tokenSecretKey = tokenProperties.secretKey();
        final String tokenPublicKey = tokenProperties.publicKey();
        if (StringUtils.isNotBlank(tokenSecretKey)) {
            return decodeSecretKey(readKeyFromUrl(tokenSecretKey));
        } else if (StringUtils.isNotBlank(tokenPublicKey)) {
            return decodePublicKey(readKeyFromUrl(tokenPublicKey), algType);
        }
        return null;
    }

    private static byte[] readKeyFromUrl(String keyConfUrl) throws IOException {
        if (keyConfUrl.startsWith("data:") || keyConfUrl.startsWith("file:")) {
            try {
                return IOUtils.toByteArray(new URL(keyConfUrl));
            } catch (IOException e) {
                throw e;
            } catch (Exception e) {
                throw new IOException(e);
            }
        }
        if (Files.exists(Paths.get(keyConfUrl))) {
            return Files.readAllBytes(Paths.get(keyConfUrl));
        }
        if (Base64.isBase64(keyConfUrl)) {
            try {
                return Decoders.BASE64.decode(keyConfUrl);
            } catch (DecodingException e) {
                throw new IOException(
                        "Illegal base64 character or Key file " + keyConfUrl + " doesn't exist",
                        e);
            }
        }
        throw new IllegalArgumentException(
                "Secret/Public Key file " + keyConfUrl + " doesn't exist");
    }

    private static SecretKey decodeSecretKey(byte[] secretKey) {
        return Keys.hmacShaKeyFor(secretKey);
    }

    private static SignatureAlgorithm getPublicKeyAlgType(JwtProperties tokenProperties) {
        final String tokenPublicAlg = tokenProperties.publicAlg();
        if (StringUtils.isBlank(tokenPublicAlg)) {
            return SignatureAlgorithm.RS256;
        }
        try {
            return SignatureAlgorithm.forName(tokenPublicAlg);
        } catch (SignatureException e) {
            throw new IllegalArgumentException("invalid algorithm provided " + tokenPublicAlg, e);
        }
    }

    private static PublicKey decodePublicKey(byte[] key, SignatureAlgorithm algType)
            throws IOException {
        try {
            final X509EncodedKeySpec spec = new X509EncodedKeySpec(key);
            final KeyFactory kf = KeyFactory.getInstance(keyTypeForSignatureAlgorithm(algType));
            return kf.generatePublic(spec);
        } catch (Exception e) {
            throw new IOException("Failed to decode public key", e);
        }
    }

    private static String keyTypeForSignatureAlgorithm(SignatureAlgorithm alg) {
        return switch (alg.getFamilyName()) {
            case "RSA" -> "RSA";
            case "ECDSA" -> "EC";
            default -> throw new IllegalArgumentException(
                    "The " + alg.name() + " algorithm does not support Key Pairs.");
        };
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return StringUtils.isNotBlank(value) ? value : defaultValue;
    }
}
