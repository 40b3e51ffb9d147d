package dbft.consensus.message;

public enum ChangeViewReason {
    TIMEOUT(0x00),
    CHANGE_AGREEMENT(0x01),
    TX_NOT_FOUND(0x02),
    TX_REJECTED_BY_POLICY(0x03),
    TX_INVALID(0x04),
    BLOCK_REJECTED_BY_POLICY(0x05);

    private final int tag;

    ChangeViewReason(int tag) { this.tag = tag; }

    public int tag() { return tag; }

    public static ChangeViewReason fromTag(int tag) {
        for (ChangeViewReason r : values()) {
            if (r.tag == tag) return r;
        }
        throw new IllegalArgumentException("unknown change view reason 0x" + Integer.toHexString(tag));
    }
}
