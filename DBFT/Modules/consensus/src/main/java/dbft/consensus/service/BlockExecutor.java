package dbft.consensus.service;

import java.util.Optional;

/** The ledger the consensus drives. */
public interface BlockExecutor {

    /** Height the next block will be finalized at; used when there is no snapshot to resume from. */
    long nextHeight();

    /** Builds a candidate block for {@code height}, or empty when there is nothing to propose yet. */
    Optional<BlockProposal> propose(long height);

    void execute(FinalizedBlock block);
}
