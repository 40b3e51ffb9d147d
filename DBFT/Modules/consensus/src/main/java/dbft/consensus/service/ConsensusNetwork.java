package dbft.consensus.service;

import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;

/** Outbound side of the peer network. Implementations must not block the consensus task for long. */
public interface ConsensusNetwork {

    void broadcast(SignedMessage message);

    /** Called after this node has moved to {@code newView}. */
    default void onViewChanged(long height, ViewNumber newView) {}
}
