package dbft.consensus.core;

import dbft.consensus.message.ConsensusMessage.RecoveryMessage;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.Validator;
import dbft.consensus.validator.ValidatorId;
import dbft.consensus.validator.ValidatorSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The dBFT decision core. Owns one {@link ConsensusState}; {@link #processMessage} is the only
 * way votes get in, and it authenticates every message before the state sees it.
 * <p>
 * Not thread-safe. Exactly one logical owner may call into an engine.
 */
public final class DbftEngine {
    private static final Logger log = LoggerFactory.getLogger(DbftEngine.class);

    private final ConsensusState state;
    private final SignatureVerifier verifier;

    public DbftEngine(ConsensusState state, SignatureVerifier verifier) {
        this.state = Objects.requireNonNull(state, "state");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    public static DbftEngine fromSnapshot(ValidatorSet validators, SnapshotState snapshot, SignatureVerifier verifier)
            throws ConsensusException {
        return new DbftEngine(ConsensusState.fromSnapshot(validators, snapshot), verifier);
    }

    public ConsensusState state() { return state; }

    public SnapshotState snapshot() { return state.snapshot(); }

    public int quorumThreshold() { return state.quorumThreshold(); }

    public Optional<ValidatorId> primary() { return state.primary(); }

    public Optional<List<ValidatorId>> expectedParticipants(MessageKind kind) { return state.expectedParticipants(kind); }

    public List<ValidatorId> missingValidators(MessageKind kind) { return state.missingValidators(kind); }

    public Map<MessageKind, List<ValidatorId>> participation() { return state.participation(); }

    public Map<MessageKind, Integer> tallies() { return state.tallies(); }

    public RecoveryMessage buildRecoveryMessage() { return state.toRecoveryMessage(); }

    /**
     * Authenticates {@code message}, records it and returns what the votes now add up to.
     * A view-change quorum is applied before returning.
     */
    public QuorumDecision processMessage(SignedMessage message) throws ConsensusException {
        verifySignature(message);
        if (message.kind() == MessageKind.RECOVERY_MESSAGE) {
            return processRecovery(message);
        }
        state.record(message);
        log.debug("Accepted {} (h={}, v={}) from {}", message.kind(), message.height(), message.view(), message.validator());
        return decide();
    }

    /** Feeds a batch through {@link #processMessage}, carrying on past rejected messages. */
    public List<ReplayResult> replayMessages(Iterable<SignedMessage> messages) {
        List<ReplayResult> out = new ArrayList<>();
        for (SignedMessage m : messages) {
            try {
                out.add(new ReplayResult.Applied(m, processMessage(m)));
            } catch (ConsensusException e) {
                log.debug("Replay skipped {}: {}", m, e.getMessage());
                out.add(new ReplayResult.Skipped(m, e));
            }
        }
        return out;
    }

    public void advanceHeight(long newHeight) throws ConsensusException.InvalidHeight {
        long from = state.height();
        state.advanceHeight(newHeight);
        log.info("Height advanced {} -> {}", from, newHeight);
    }

    private QuorumDecision decide() {
        QuorumDecision decision = state.quorumDecision();
        if (decision instanceof QuorumDecision.ViewChange vc) {
            log.info("View change quorum at height {}: {} -> {} (missing {})", state.height(), state.view(), vc.newView(), vc.missing());
            state.applyViewChange(vc.newView());
        }
        return decision;
    }

    /**
     * The compacted messages are replayed one by one, each against its own signature. Change views
     * come first, so a node one view behind the sender reaches the sender's view and the rest of the
     * bundle lands there. The envelope is kept for bookkeeping once this node is not behind it.
     */
    private QuorumDecision processRecovery(SignedMessage envelope) throws ConsensusException {
        if (envelope.height() != state.height()) throw new ConsensusException.InvalidHeight(state.height(), envelope.height());
        RecoveryMessage recovery = (RecoveryMessage) envelope.message();
        ViewNumber before = state.view();
        QuorumDecision strongest = null;
        int applied = 0;
        for (ReplayResult r : replayMessages(recovery.expand(envelope.height(), envelope.view()))) {
            if (r instanceof ReplayResult.Applied a) {
                applied++;
                if (!(a.decision() instanceof QuorumDecision.Pending)) strongest = a.decision();
            }
        }
        if (!envelope.view().isAfter(state.view())) {
            state.record(envelope);
        }
        log.debug("Recovery from {} applied {} message(s), v={} -> {}", envelope.validator(), applied, before, state.view());
        return strongest != null ? strongest : decide();
    }

    private void verifySignature(SignedMessage message) throws ConsensusException {
        Validator validator = state.validators().get(message.validator())
                .orElseThrow(() -> new ConsensusException.UnknownValidator(message.validator()));
        try {
            verifier.verify(message.digest(), message.signature(), validator.publicKey());
        } catch (GeneralSecurityException e) {
            log.warn("Rejected {} from {}: {}", message.kind(), message.validator(), e.getMessage());
            throw new ConsensusException.InvalidSignature(message.validator());
        }
    }
}
