package dbft.consensus.message;

import com.google.protobuf.ByteString;
import dbft.consensus.core.MessageSigner;
import dbft.consensus.validator.ValidatorId;

import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * A consensus payload together with its sender, the (height, view) it belongs to and the sender's
 * signature over {@link #digest()}.
 */
public record SignedMessage(long height, ValidatorId validator, ViewNumber view, ConsensusMessage message,
                            ByteString signature) {
    public SignedMessage {
        Objects.requireNonNull(validator, "validator");
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(message, "message");
        if (height < 0) throw new IllegalArgumentException("height must be non-negative: " + height);
        if (signature == null) signature = ByteString.EMPTY;
    }

    public static SignedMessage sign(long height, ValidatorId validator, ViewNumber view, ConsensusMessage message,
                                     MessageSigner signer) throws GeneralSecurityException {
        ByteString digest = MessageCodec.encodeUnsigned(height, validator, view, message);
        return new SignedMessage(height, validator, view, message, signer.sign(digest));
    }

    public MessageKind kind() { return message.kind(); }

    /** Canonical bytes of (height, validator, view, message); what the sender signed. */
    public ByteString digest() { return MessageCodec.encodeUnsigned(height, validator, view, message); }

    public SignedMessage withSignature(ByteString newSignature) {
        return new SignedMessage(height, validator, view, message, newSignature);
    }

    @Override public String toString() {
        return message.kind() + "{h=" + height + ", v=" + view + ", from=" + validator + "}";
    }
}
