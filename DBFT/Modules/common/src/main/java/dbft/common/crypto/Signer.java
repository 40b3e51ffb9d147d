package dbft.common.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.*;

/**
 * ECDSA over secp256r1 with SHA-256. Signatures use the fixed 64-byte r||s layout.
 * The signed input is {@code domain || 0x00 || payload}, which keeps signatures from one
 * network from verifying on another.
 */
public final class Signer {
    private Signer() {}

    public static final String ALGORITHM = "SHA256withECDSAinP1363Format";
    public static final int SIGNATURE_LENGTH = 64;

    public static byte[] sign(String domain, byte[] payload, PrivateKey sk) throws GeneralSecurityException {
        Signature s = Signature.getInstance(ALGORITHM);
        s.initSign(sk);
        s.update(join(domain, payload));
        return s.sign();
    }

    /**
     * Returns false for a signature that does not match, and also for one that is not even
     * well formed (wrong length, zero scalars).
     */
    public static boolean verify(String domain, byte[] payload, byte[] signature, PublicKey pk)
            throws GeneralSecurityException {
        if (signature == null || signature.length != SIGNATURE_LENGTH) return false;
        Signature s = Signature.getInstance(ALGORITHM);
        s.initVerify(pk);
        s.update(join(domain, payload));
        try {
            return s.verify(signature);
        } catch (SignatureException malformed) {
            return false;
        }
    }

    public static String networkDomain(long network) {
        return "DBFT:" + Long.toUnsignedString(network & 0xFFFFFFFFL);
    }

    private static byte[] join(String domain, byte[] p) {
        byte[] d = domain.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(d.length + 1 + p.length);
        buf.put(d).put((byte) 0).put(p);
        return buf.array();
    }
}
