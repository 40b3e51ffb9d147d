package dbft.consensus.core;

import dbft.consensus.message.SignedMessage;

/** Outcome of feeding one message of a batch through the engine. */
public interface ReplayResult {

    SignedMessage message();

    record Applied(SignedMessage message, QuorumDecision decision) implements ReplayResult {}

    record Skipped(SignedMessage message, ConsensusException reason) implements ReplayResult {}
}
