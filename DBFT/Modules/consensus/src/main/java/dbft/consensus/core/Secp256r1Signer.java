package dbft.consensus.core;

import com.google.protobuf.ByteString;
import dbft.common.crypto.Signer;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.Objects;

public final class Secp256r1Signer implements MessageSigner {
    private final String domain;
    private final PrivateKey key;

    public Secp256r1Signer(long network, PrivateKey key) {
        this.domain = Signer.networkDomain(network);
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public ByteString sign(ByteString digest) throws GeneralSecurityException {
        return ByteString.copyFrom(Signer.sign(domain, digest.toByteArray(), key));
    }
}
