package dbft.consensus.message;

import com.google.protobuf.ByteString;
import dbft.common.crypto.Digests;
import dbft.common.util.Hex;

import java.util.Objects;

public record Hash256(ByteString bytes) {
    public static final int LENGTH = Digests.SHA256_LENGTH;
    public static final Hash256 ZERO = new Hash256(ByteString.copyFrom(new byte[LENGTH]));

    public Hash256 {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.size() != LENGTH) throw new IllegalArgumentException("hash must be 32 bytes, got " + bytes.size());
    }

    public static Hash256 of(byte[] bytes) { return new Hash256(ByteString.copyFrom(bytes)); }

    public static Hash256 fromHex(String hex) { return of(Hex.fromHex(hex)); }

    /** Double SHA-256 of {@code data}. */
    public static Hash256 hash(byte[] data) { return of(Digests.hash256(data)); }

    public byte[] toByteArray() { return bytes.toByteArray(); }

    public String toHex() { return Hex.toHex(bytes.toByteArray()); }

    @Override public String toString() { return Hex.shortHex(bytes.toByteArray(), 16); }
}
