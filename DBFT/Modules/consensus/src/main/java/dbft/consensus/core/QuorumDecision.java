package dbft.consensus.core;

import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.ValidatorId;

import java.util.List;
import java.util.Objects;

/** What the votes on file add up to. Computed after every accepted message, never stored. */
public interface QuorumDecision {

    Pending PENDING = new Pending();

    record Pending() implements QuorumDecision {}

    /** {@code kind} is COMMIT or PREPARE_RESPONSE; {@code missing} lists validators that have not voted. */
    record Proposal(MessageKind kind, Hash256 proposal, List<ValidatorId> missing) implements QuorumDecision {
        public Proposal {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(proposal, "proposal");
            missing = List.copyOf(missing);
        }
    }

    record ViewChange(ViewNumber newView, List<ValidatorId> missing) implements QuorumDecision {
        public ViewChange {
            Objects.requireNonNull(newView, "newView");
            missing = List.copyOf(missing);
        }
    }
}
