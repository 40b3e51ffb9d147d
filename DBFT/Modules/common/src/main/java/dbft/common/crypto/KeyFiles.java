package dbft.common.crypto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.*;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/** secp256r1 key generation and PEM (PKCS#8 / X.509) key files. */
public final class KeyFiles {
    private KeyFiles() {}

    public static final String CURVE = "secp256r1";
    public static final String PRIVATE_KEY_FILE = "secp256r1.key";
    public static final String PUBLIC_KEY_FILE = "secp256r1.pub";

    public static KeyPair generateKeyPair() throws GeneralSecurityException {
        KeyPairGenerator kpg = KeyPairGenerator.getInstance("EC");
        kpg.initialize(new ECGenParameterSpec(CURVE));
        return kpg.generateKeyPair();
    }

    public static void writeKeyPair(Path privatePem, Path publicPem, KeyPair kp) throws IOException {
        writePem(privatePem, "PRIVATE KEY", kp.getPrivate().getEncoded());
        writePem(publicPem, "PUBLIC KEY", kp.getPublic().getEncoded());
    }

    public static PrivateKey loadPrivateKeyPem(Path privatePem) throws GeneralSecurityException, IOException {
        byte[] der = readPem(privatePem, "PRIVATE KEY");
        return KeyFactory.getInstance("EC").generatePrivate(new PKCS8EncodedKeySpec(der));
    }

    public static PublicKey loadPublicKeyPem(Path publicPem) throws GeneralSecurityException, IOException {
        return decodePublicKey(readPem(publicPem, "PUBLIC KEY"));
    }

    /** Inverse of {@link PublicKey#getEncoded()} for EC keys. */
    public static PublicKey decodePublicKey(byte[] x509) throws InvalidKeySpecException {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(x509));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("EC key factory unavailable", e);
        }
    }

    private static void writePem(Path path, String type, byte[] der) throws IOException {
        String base64 = Base64.getMimeEncoder(64, new byte[]{'\n'}).encodeToString(der);
        String pem = "-----BEGIN " + type + "-----\n" + base64 + "\n-----END " + type + "-----\n";
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, pem, StandardCharsets.US_ASCII, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static byte[] readPem(Path path, String type) throws IOException {
        String all = Files.readString(path, StandardCharsets.US_ASCII);
        String begin = "-----BEGIN " + type + "-----";
        String end   = "-----END " + type + "-----";
        int i = all.indexOf(begin), j = all.indexOf(end);
        if (i < 0 || j < 0) throw new IOException("Invalid PEM: " + path);
        String b64 = all.substring(i + begin.length(), j).replaceAll("\\s", "");
        return Base64.getDecoder().decode(b64);
    }
}
