/*
 *   Copyright Calrissian Hooks Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.eoepca.calrissian.eoepca.identity;

import java.io.IOException;
import java.util.Base64;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the claims out of a JSON Web Token. The signature is NOT verified.
 */
public final class JwtClaims {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<Map<String, Object>>() {};

    private JwtClaims() {}

    public static Map<String, Object> decodeUnverified(String token) {
        if (token == null || token.isEmpty()) {
            throw new MalformedTokenException("The token is empty.");
        }
        String[] segments = token.split("\\.");
        if (segments.length < 2) {
            throw new MalformedTokenException("The token does not have a payload segment.");
        }

        byte[] payload;
        try {
            payload = Base64.getUrlDecoder().decode(segments[1]);
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("The token payload is not base64url-encoded.", e);
        }

        try {
            Map<String, Object> claims = MAPPER.readValue(payload, CLAIMS_TYPE);
            if (claims == null) {
                throw new MalformedTokenException("The token payload is empty.");
            }
            return claims;
        } catch (IOException e) {
            throw new MalformedTokenException("The token payload is not a JSON object.", e);
        }
    }
}
