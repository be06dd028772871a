package com.kincircle.trust.service;

import com.kincircle.trust.service.model.AlgorithmVersion;
import com.kincircle.trust.service.model.Credential;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Derives and verifies PIN hashes.
 *
 * <p>Current records are PBKDF2-HMAC-SHA256, 100000 iterations, 256-bit output, with a
 * random 128-bit salt. The salt is kept as lowercase hex and the KDF is fed the UTF-8
 * bytes of that hex string, which is what existing clients stored.
 *
 * <p>Two legacy flavours are still accepted by {@link #verify(String, String)} so that
 * old records can be checked once and then re-hashed by the caller.
 */
@Component
public class CredentialHasher {

    public static final int ITERATIONS = 100_000;
    public static final int KEY_LENGTH_BITS = 256;
    public static final int SALT_BYTES = 16;

    static final String LEGACY_STATIC_SALT = "kincircle-pin-salt-v1";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";

    private final SecureRandom random;

    public CredentialHasher() {
        this(new SecureRandom());
    }

    public CredentialHasher(SecureRandom random) {
        this.random = random;
    }

    /** Salts and hashes a PIN. The caller validates the PIN format first. */
    public Credential hash(String pin) {
        if (pin == null || pin.isEmpty()) {
            throw new IllegalArgumentException("pin must not be empty");
        }
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        String saltHex = HashUtil.toHex(salt);
        return new Credential(saltHex, derive(pin, saltHex), AlgorithmVersion.SALTED_PBKDF2);
    }

    /**
     * Checks a PIN against a stored value in any supported format.
     * Malformed values ("$hash", "salt$", blank) yield {@code false}; this method never throws.
     */
    public boolean verify(String pin, String stored) {
        return Credential.parse(stored)
                .map(c -> verify(pin, c))
                .orElse(false);
    }

    public boolean verify(String pin, Credential credential) {
        if (pin == null || pin.isEmpty() || credential == null || credential.hashHex() == null) {
            return false;
        }
        String computed = switch (credential.algorithmVersion()) {
            case SALTED_PBKDF2 -> credential.saltHex() == null ? null : derive(pin, credential.saltHex());
            case LEGACY_STATIC_SALT -> derive(pin, LEGACY_STATIC_SALT);
            case LEGACY_STRING_HASH -> legacyHash(pin);
        };
        return HashUtil.constantTimeEquals(computed, credential.hashHex());
    }

    /**
     * The original 32-bit string hash in base 36. Weak; only for verifying and
     * migrating records written before salted hashing existed.
     */
    @Deprecated
    public static String legacyHash(String pin) {
        int hash = 0;
        for (int i = 0; i < pin.length(); i++) {
            hash = ((hash << 5) - hash) + pin.charAt(i);
        }
        return Integer.toString(hash, 36);
    }

    /** Hex string of {@code bytes} random bytes, for invite codes and similar tokens. */
    public String generateSecureToken(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return HashUtil.toHex(buf);
    }

    String derive(String pin, String salt) {
        char[] chars = pin.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, salt.getBytes(StandardCharsets.UTF_8), ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return HashUtil.toHex(key);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }
}
