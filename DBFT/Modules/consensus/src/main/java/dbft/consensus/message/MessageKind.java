package dbft.consensus.message;

/**
 * Consensus message types. The tags are part of the wire format and must never be renumbered.
 */
public enum MessageKind {
    CHANGE_VIEW(0x00, true),
    PREPARE_REQUEST(0x20, true),
    PREPARE_RESPONSE(0x21, true),
    COMMIT(0x30, true),
    RECOVERY_REQUEST(0x40, false),
    RECOVERY_MESSAGE(0x41, false);

    private final int tag;
    private final boolean viewScoped;

    MessageKind(int tag, boolean viewScoped) {
        this.tag = tag;
        this.viewScoped = viewScoped;
    }

    public int tag() { return tag; }

    /** Records of a view-scoped kind are discarded when the view changes. */
    public boolean viewScoped() { return viewScoped; }

    public static MessageKind fromTag(int tag) {
        for (MessageKind k : values()) {
            if (k.tag == tag) return k;
        }
        throw new IllegalArgumentException("unknown message kind tag 0x" + Integer.toHexString(tag));
    }
}
