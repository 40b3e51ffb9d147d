package dbft.consensus.core;

import com.google.protobuf.ByteString;
import dbft.common.crypto.Signer;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.SignatureException;

public final class Secp256r1Verifier implements SignatureVerifier {
    private final String domain;

    public Secp256r1Verifier(long network) {
        this.domain = Signer.networkDomain(network);
    }

    @Override
    public void verify(ByteString digest, ByteString signature, PublicKey publicKey) throws GeneralSecurityException {
        if (!Signer.verify(domain, digest.toByteArray(), signature.toByteArray(), publicKey)) {
            throw new SignatureException("signature mismatch");
        }
    }
}
