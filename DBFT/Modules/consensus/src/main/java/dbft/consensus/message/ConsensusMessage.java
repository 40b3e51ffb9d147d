package dbft.consensus.message;

import com.google.protobuf.ByteString;
import dbft.consensus.validator.ValidatorId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of a consensus message. The set of variants is closed: one record per {@link MessageKind},
 * and every consumer dispatches with a {@code switch} over {@link #kind()}.
 */
public interface ConsensusMessage {

    MessageKind kind();

    /** The proposal hash a message votes for; only prepare request and prepare response carry one. */
    default Optional<Hash256> proposalHash() { return Optional.empty(); }

    record ChangeView(ChangeViewReason reason, long timestamp) implements ConsensusMessage {
        public ChangeView {
            Objects.requireNonNull(reason, "reason");
        }

        public ChangeView(ChangeViewReason reason) { this(reason, 0L); }

        @Override public MessageKind kind() { return MessageKind.CHANGE_VIEW; }
    }

    record PrepareRequest(Hash256 proposal, long height, List<Hash256> txHashes, long timestamp, long nonce)
            implements ConsensusMessage {
        public PrepareRequest {
            Objects.requireNonNull(proposal, "proposal");
            txHashes = List.copyOf(txHashes);
        }

        public PrepareRequest(Hash256 proposal, long height, List<Hash256> txHashes) {
            this(proposal, height, txHashes, 0L, 0L);
        }

        @Override public MessageKind kind() { return MessageKind.PREPARE_REQUEST; }

        @Override public Optional<Hash256> proposalHash() { return Optional.of(proposal); }
    }

    record PrepareResponse(Hash256 preparationHash) implements ConsensusMessage {
        public PrepareResponse {
            Objects.requireNonNull(preparationHash, "preparationHash");
        }

        @Override public MessageKind kind() { return MessageKind.PREPARE_RESPONSE; }

        @Override public Optional<Hash256> proposalHash() { return Optional.of(preparationHash); }
    }

    /** {@code signature} is the validator's signature over the block, not the message envelope. */
    record Commit(ByteString signature) implements ConsensusMessage {
        public Commit {
            Objects.requireNonNull(signature, "signature");
        }

        @Override public MessageKind kind() { return MessageKind.COMMIT; }
    }

    record RecoveryRequest(long timestamp) implements ConsensusMessage {
        @Override public MessageKind kind() { return MessageKind.RECOVERY_REQUEST; }
    }

    record ChangeViewCompact(ValidatorId validator, ViewNumber originalView, ChangeViewReason reason,
                             long timestamp, ByteString signature) {}

    record PrepareRequestCompact(ValidatorId validator, PrepareRequest request, ByteString signature) {}

    record PreparationCompact(ValidatorId validator, ByteString signature) {}

    record CommitCompact(ValidatorId validator, ViewNumber view, ByteString commitSignature, ByteString signature) {}

    /**
     * Everything a validator has seen in its current view, one entry per contributing validator,
     * each keeping the signature of the message it was compacted from. The change views also cover
     * the quorum that led into that view.
     */
    record RecoveryMessage(List<ChangeViewCompact> changeViews,
                           PrepareRequestCompact prepareRequest,
                           Hash256 preparationHash,
                           List<PreparationCompact> preparations,
                           List<CommitCompact> commits) implements ConsensusMessage {
        public RecoveryMessage {
            changeViews = List.copyOf(changeViews);
            preparations = List.copyOf(preparations);
            commits = List.copyOf(commits);
        }

        @Override public MessageKind kind() { return MessageKind.RECOVERY_MESSAGE; }

        public Optional<PrepareRequestCompact> prepareRequestOpt() { return Optional.ofNullable(prepareRequest); }

        public Optional<Hash256> preparationHashOpt() { return Optional.ofNullable(preparationHash); }

        /**
         * Rebuilds the signed messages this recovery message was compacted from. Prepare responses
         * can only be rebuilt when the proposal hash is known, either from the embedded request
         * or from {@link #preparationHash()}.
         */
        public List<SignedMessage> expand(long height, ViewNumber view) {
            List<SignedMessage> out = new ArrayList<>();
            for (ChangeViewCompact cv : changeViews) {
                out.add(new SignedMessage(height, cv.validator(), cv.originalView(),
                        new ChangeView(cv.reason(), cv.timestamp()), cv.signature()));
            }
            Hash256 hash = preparationHash;
            if (prepareRequest != null) {
                out.add(new SignedMessage(height, prepareRequest.validator(), view,
                        prepareRequest.request(), prepareRequest.signature()));
                hash = prepareRequest.request().proposal();
            }
            if (hash != null) {
                for (PreparationCompact p : preparations) {
                    out.add(new SignedMessage(height, p.validator(), view, new PrepareResponse(hash), p.signature()));
                }
            }
            for (CommitCompact c : commits) {
                out.add(new SignedMessage(height, c.validator(), c.view(), new Commit(c.commitSignature()), c.signature()));
            }
            return out;
        }
    }
}
