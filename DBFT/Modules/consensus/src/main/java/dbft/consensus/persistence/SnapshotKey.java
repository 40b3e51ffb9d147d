package dbft.consensus.persistence;

/** Row key of a consensus snapshot: the network (chain) id, 4 bytes little-endian on disk. */
public record SnapshotKey(long network) {
    public static final String COLUMN = "consensus.snapshot";

    public SnapshotKey {
        if (network < 0 || network > 0xFFFFFFFFL) throw new IllegalArgumentException("network must fit in u32: " + network);
    }

    public byte[] toBytes() {
        return new byte[]{
                (byte) network,
                (byte) (network >>> 8),
                (byte) (network >>> 16),
                (byte) (network >>> 24)
        };
    }
}
