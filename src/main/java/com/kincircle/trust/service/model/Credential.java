package com.kincircle.trust.service.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A stored PIN credential. {@code saltHex} is {@code null} for legacy records.
 */
public record Credential(String saltHex, String hashHex, AlgorithmVersion algorithmVersion) {

    public static final String SEPARATOR = "$";

    private static final Pattern PBKDF2_HEX = Pattern.compile("^[0-9a-f]{64}$");

    public boolean isSecure() {
        return algorithmVersion.isSecure();
    }

    /** Storage form: "salt$hash" for salted records, the bare hash otherwise. */
    public String serialize() {
        return isSecure() ? saltHex + SEPARATOR + hashHex : hashHex;
    }

    /**
     * Reads a stored value. Values without a separator are legacy: 64 lowercase hex
     * chars are the fixed-salt PBKDF2 flavour, anything else the old string hash.
     * Returns empty when a salted value is missing either half.
     */
    public static Optional<Credential> parse(String stored) {
        if (stored == null || stored.isBlank()) return Optional.empty();
        int sep = stored.indexOf(SEPARATOR);
        if (sep < 0) {
            AlgorithmVersion v = PBKDF2_HEX.matcher(stored).matches()
                    ? AlgorithmVersion.LEGACY_STATIC_SALT
                    : AlgorithmVersion.LEGACY_STRING_HASH;
            return Optional.of(new Credential(null, stored, v));
        }
        String salt = stored.substring(0, sep);
        String hash = stored.substring(sep + 1);
        if (salt.isEmpty() || hash.isEmpty() || hash.contains(SEPARATOR)) {
            return Optional.empty();
        }
        return Optional.of(new Credential(salt, hash, AlgorithmVersion.SALTED_PBKDF2));
    }

    @Override
    public String toString() {
        // never print hash material
        return "Credential[" + algorithmVersion + "]";
    }
}
