package dbft.common.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Digests {
    private Digests() {}

    public static final int SHA256_LENGTH = 32;

    public static byte[] sha256(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** SHA-256 applied twice, the NEO block and transaction hash. */
    public static byte[] hash256(byte[] input) {
        return sha256(sha256(input));
    }
}
