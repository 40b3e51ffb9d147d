package dbft.common.crypto;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SignerTest {

    private static KeyPair keys;
    private static final byte[] PAYLOAD = "block-7".getBytes(StandardCharsets.UTF_8);

    @BeforeAll
    static void generate() throws Exception {
        keys = KeyFiles.generateKeyPair();
    }

    @Test
    void signatureIsFixedLengthAndVerifies() throws Exception {
        String domain = Signer.networkDomain(860833102L);
        byte[] sig = Signer.sign(domain, PAYLOAD, keys.getPrivate());

        assertThat(sig).hasSize(Signer.SIGNATURE_LENGTH);
        assertThat(Signer.verify(domain, PAYLOAD, sig, keys.getPublic())).isTrue();
    }

    @Test
    void otherNetworkDoesNotVerify() throws Exception {
        byte[] sig = Signer.sign(Signer.networkDomain(1), PAYLOAD, keys.getPrivate());

        assertThat(Signer.verify(Signer.networkDomain(2), PAYLOAD, sig, keys.getPublic())).isFalse();
    }

    @Test
    void tamperedOrMalformedSignaturesAreRejected() throws Exception {
        String domain = Signer.networkDomain(1);
        byte[] sig = Signer.sign(domain, PAYLOAD, keys.getPrivate());
        byte[] flipped = sig.clone();
        flipped[10] ^= 0x01;

        assertThat(Signer.verify(domain, PAYLOAD, flipped, keys.getPublic())).isFalse();
        assertThat(Signer.verify(domain, PAYLOAD, new byte[3], keys.getPublic())).isFalse();
        assertThat(Signer.verify(domain, PAYLOAD, new byte[Signer.SIGNATURE_LENGTH], keys.getPublic())).isFalse();
        assertThat(Signer.verify(domain, PAYLOAD, null, keys.getPublic())).isFalse();
    }

    @Test
    void networkDomainUsesLow32Bits() {
        assertThat(Signer.networkDomain(0x1_0000_0005L)).isEqualTo("DBFT:5");
    }
}
