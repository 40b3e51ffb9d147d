package dbft.common.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyFilesTest {

    @TempDir
    Path dir;

    @Test
    void writtenKeysLoadBackAndSign() throws Exception {
        KeyPair kp = KeyFiles.generateKeyPair();
        Path sk = dir.resolve("v0").resolve(KeyFiles.PRIVATE_KEY_FILE);
        Path pk = dir.resolve("v0").resolve(KeyFiles.PUBLIC_KEY_FILE);

        KeyFiles.writeKeyPair(sk, pk, kp);

        assertThat(Files.readString(pk)).startsWith("-----BEGIN PUBLIC KEY-----");
        PrivateKey loadedSk = KeyFiles.loadPrivateKeyPem(sk);
        PublicKey loadedPk = KeyFiles.loadPublicKeyPem(pk);
        assertThat(loadedPk).isEqualTo(kp.getPublic());

        String domain = Signer.networkDomain(7);
        byte[] sig = Signer.sign(domain, new byte[] {1, 2, 3}, loadedSk);
        assertThat(Signer.verify(domain, new byte[] {1, 2, 3}, sig, loadedPk)).isTrue();
    }

    @Test
    void decodePublicKeyInvertsGetEncoded() throws Exception {
        KeyPair kp = KeyFiles.generateKeyPair();
        assertThat(KeyFiles.decodePublicKey(kp.getPublic().getEncoded())).isEqualTo(kp.getPublic());
    }

    @Test
    void fileWithoutPemMarkersIsRejected() throws Exception {
        Path bogus = dir.resolve("bogus.pub");
        Files.writeString(bogus, "not a key");

        assertThatThrownBy(() -> KeyFiles.loadPublicKeyPem(bogus))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid PEM");
    }
}
