package org.nowstart.squeezewatch.service.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HS512 JWT for the Upbit {@code Authorization} header. A signer without a key pair is disabled and
 * requests go out unauthenticated.
 */
public class UpbitJwtSigner {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String HEADER_JSON = "{\"alg\":\"HS512\",\"typ\":\"JWT\"}";

    private final String accessKey;
    private final String secretKey;

    public UpbitJwtSigner(String accessKey, String secretKey) {
        this.accessKey = accessKey == null ? "" : accessKey.trim();
        this.secretKey = secretKey == null ? "" : secretKey.trim();
    }

    public boolean isEnabled() {
        return !accessKey.isEmpty() && !secretKey.isEmpty();
    }

    public String createToken(String canonicalQuery) {
        if (!isEnabled()) {
            throw new IllegalStateException("Upbit access/secret key is not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("access_key", accessKey);
        payload.put("nonce", UUID.randomUUID().toString());
        if (canonicalQuery != null && !canonicalQuery.isBlank()) {
            payload.put("query_hash", sha512Hex(canonicalQuery));
            payload.put("query_hash_alg", "SHA512");
        }

        String signingInput = base64Url(HEADER_JSON.getBytes(StandardCharsets.UTF_8))
                + "."
                + base64Url(toJson(payload).getBytes(StandardCharsets.UTF_8));
        return signingInput + "." + base64Url(hmacSha512(signingInput));
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return OBJECT_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JWT payload", e);
        }
    }

    private byte[] hmacSha512(String value) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String sha512Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    private static String base64Url(byte[] value) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(value);
    }
}
