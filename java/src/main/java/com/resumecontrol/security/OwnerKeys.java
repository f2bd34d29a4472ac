package com.resumecontrol.security;

import com.resumecontrol.model.entity.ApiKey;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Bearer secrets handed out to owners.
 *
 * A secret is {@code rc_} followed by 32 random bytes in URL-safe base64. Only
 * its SHA-256 digest and a short hint are stored, so a lost secret cannot be
 * recovered, only replaced.
 */
public final class OwnerKeys {

    static final String SECRET_PREFIX = "rc_";
    private static final int SECRET_BYTES = 32;
    private static final int HINT_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private OwnerKeys() {
    }

    /**
     * Mint a secret for {@code ownerId}. The returned key row is not yet saved.
     */
    public static Issued issue(UUID ownerId, LocalDateTime issuedAt) {
        byte[] bytes = new byte[SECRET_BYTES];
        RANDOM.nextBytes(bytes);
        String secret = SECRET_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        ApiKey key = ApiKey.builder()
                .ownerId(ownerId)
                .secretDigest(digest(secret))
                .hint(secret.substring(0, HINT_LENGTH))
                .issuedAt(issuedAt)
                .build();
        return new Issued(secret, key);
    }

    /**
     * Cheap shape check so that foreign tokens never reach the store.
     */
    public static boolean isWellFormed(String secret) {
        return secret != null
                && secret.startsWith(SECRET_PREFIX)
                && secret.length() > SECRET_PREFIX.length();
    }

    public static String digest(String secret) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * A freshly minted secret and the row that will represent it.
     */
    @Value
    public static class Issued {
        String secret;
        ApiKey key;
    }
}
