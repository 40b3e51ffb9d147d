package dbft.consensus.core;

import com.google.protobuf.ByteString;

import java.security.GeneralSecurityException;

/** Produces this node's signatures. Backed by the wallet; the consensus core never sees the key. */
@FunctionalInterface
public interface MessageSigner {

    ByteString sign(ByteString digest) throws GeneralSecurityException;
}
