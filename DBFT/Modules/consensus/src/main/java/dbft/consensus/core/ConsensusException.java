package dbft.consensus.core;

import dbft.consensus.message.Hash256;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.ValidatorId;

/**
 * Rejection of a single inbound consensus message. The state the message was offered to is left
 * exactly as it was; callers log the rejection and carry on with the next message.
 */
public abstract class ConsensusException extends Exception {

    protected ConsensusException(String message) {
        super(message);
    }

    public static final class UnknownValidator extends ConsensusException {
        private final ValidatorId validator;

        public UnknownValidator(ValidatorId validator) {
            super("unknown validator " + validator);
            this.validator = validator;
        }

        public ValidatorId validator() { return validator; }
    }

    public static final class InvalidSignature extends ConsensusException {
        private final ValidatorId validator;

        public InvalidSignature(ValidatorId validator) {
            super("invalid signature from " + validator);
            this.validator = validator;
        }

        public ValidatorId validator() { return validator; }
    }

    public static final class ProposalMismatch extends ConsensusException {
        private final Hash256 expected;
        private final Hash256 actual;

        public ProposalMismatch(Hash256 expected, Hash256 actual) {
            super("proposal mismatch: expected " + expected + " but got " + actual);
            this.expected = expected;
            this.actual = actual;
        }

        public Hash256 expected() { return expected; }
        public Hash256 actual() { return actual; }
    }

    public static final class MissingPrepareResponse extends ConsensusException {
        private final ValidatorId validator;

        public MissingPrepareResponse(ValidatorId validator) {
            super("commit from " + validator + " without a prepare response on file");
            this.validator = validator;
        }

        public ValidatorId validator() { return validator; }
    }

    public static final class InvalidHeight extends ConsensusException {
        private final long expected;
        private final long received;

        public InvalidHeight(long expected, long received) {
            super("height " + received + " does not match expected " + expected);
            this.expected = expected;
            this.received = received;
        }

        public long expected() { return expected; }
        public long received() { return received; }
    }

    /** The message is for a view this node has not reached. */
    public static final class InvalidView extends ConsensusException {
        private final ViewNumber current;
        private final ViewNumber received;

        public InvalidView(ViewNumber current, ViewNumber received) {
            super("view " + received + " is ahead of current view " + current);
            this.current = current;
            this.received = received;
        }

        public ViewNumber current() { return current; }
        public ViewNumber received() { return received; }
    }

    public static final class InvalidPrimary extends ConsensusException {
        private final ValidatorId expected;
        private final ValidatorId actual;

        public InvalidPrimary(ValidatorId expected, ValidatorId actual) {
            super("prepare request from " + actual + " but the primary is " + expected);
            this.expected = expected;
            this.actual = actual;
        }

        public ValidatorId expected() { return expected; }
        public ValidatorId actual() { return actual; }
    }
}
