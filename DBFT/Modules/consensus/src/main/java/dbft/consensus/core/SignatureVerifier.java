package dbft.consensus.core;

import com.google.protobuf.ByteString;

import java.security.GeneralSecurityException;
import java.security.PublicKey;

/** Verifies a validator's signature over a message digest. Implementations are stateless. */
@FunctionalInterface
public interface SignatureVerifier {

    /** @throws GeneralSecurityException if the signature does not match or cannot be checked */
    void verify(ByteString digest, ByteString signature, PublicKey publicKey) throws GeneralSecurityException;
}
