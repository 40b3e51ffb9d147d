package dbft.consensus.core;

import dbft.consensus.message.ChangeViewReason;
import dbft.consensus.message.ConsensusMessage;
import dbft.consensus.message.ConsensusMessage.ChangeView;
import dbft.consensus.message.ConsensusMessage.ChangeViewCompact;
import dbft.consensus.message.ConsensusMessage.Commit;
import dbft.consensus.message.ConsensusMessage.CommitCompact;
import dbft.consensus.message.ConsensusMessage.PrepareRequest;
import dbft.consensus.message.ConsensusMessage.PrepareRequestCompact;
import dbft.consensus.message.ConsensusMessage.PreparationCompact;
import dbft.consensus.message.ConsensusMessage.RecoveryMessage;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.ValidatorId;
import dbft.consensus.validator.ValidatorSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Votes collected for one block height: which validator sent which message in which view,
 * the proposal agreed on for the current view, and the change-view tallies.
 * <p>
 * Pure data plus transition helpers, no I/O and no locking. The owner (normally a
 * {@link DbftEngine} running on the consensus task) serializes all calls.
 * <p>
 * Messages from an earlier view are kept for bookkeeping (recovery and diagnostics) but never
 * count towards a quorum of the current view.
 */
public final class ConsensusState {
    private long height;
    private ViewNumber view;
    private final ValidatorSet validators;

    private final Map<MessageKind, List<SignedMessage>> records = new EnumMap<>(MessageKind.class);
    private final Map<MessageKind, List<ValidatorId>> expected = new EnumMap<>(MessageKind.class);
    private Hash256 proposal;

    private final Map<ValidatorId, ChangeViewReason> changeViewReasons = new TreeMap<>();
    private final Map<ChangeViewReason, Integer> changeViewReasonCounts = new EnumMap<>(ChangeViewReason.class);
    private int changeViewTotal;

    // change views of the quorum that moved this state into the current view
    private final List<SignedMessage> lastChangeViews = new ArrayList<>();

    public ConsensusState(long height, ViewNumber view, ValidatorSet validators) {
        if (height < 0) throw new IllegalArgumentException("height must be non-negative: " + height);
        this.height = height;
        this.view = Objects.requireNonNull(view, "view");
        this.validators = Objects.requireNonNull(validators, "validators");
    }

    public long height() { return height; }

    public ViewNumber view() { return view; }

    public ValidatorSet validators() { return validators; }

    public Optional<Hash256> proposal() { return Optional.ofNullable(proposal); }

    public int quorumThreshold() { return validators.quorum(); }

    public Optional<ValidatorId> primary() { return validators.primaryId(height, view); }

    public List<SignedMessage> records(MessageKind kind) {
        List<SignedMessage> list = records.get(kind);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public Optional<List<ValidatorId>> expectedParticipants(MessageKind kind) {
        List<ValidatorId> list = expected.get(kind);
        return list == null ? Optional.empty() : Optional.of(List.copyOf(list));
    }

    public Map<ValidatorId, ChangeViewReason> changeViewReasons() { return Collections.unmodifiableMap(changeViewReasons); }

    public int changeViewReasonCount(ChangeViewReason reason) { return changeViewReasonCounts.getOrDefault(reason, 0); }

    public int changeViewTotal() { return changeViewTotal; }

    /** The change views that moved this state out of the previous view, empty at view zero. */
    public List<SignedMessage> lastChangeViews() { return Collections.unmodifiableList(lastChangeViews); }

    /** Senders on file per kind, in arrival order, current and earlier views alike. */
    public Map<MessageKind, List<ValidatorId>> participation() {
        Map<MessageKind, List<ValidatorId>> out = new EnumMap<>(MessageKind.class);
        for (var e : records.entrySet()) {
            List<ValidatorId> ids = new ArrayList<>(e.getValue().size());
            for (SignedMessage m : e.getValue()) ids.add(m.validator());
            out.put(e.getKey(), ids);
        }
        return out;
    }

    public Map<MessageKind, Integer> tallies() {
        Map<MessageKind, Integer> out = new EnumMap<>(MessageKind.class);
        for (var e : records.entrySet()) out.put(e.getKey(), e.getValue().size());
        return out;
    }

    /**
     * Validators still owing a message of {@code kind} in the current view. For a prepare request
     * that is the primary until its request is on file; for other kinds it is empty until the
     * first message of that kind seeds the expectation.
     */
    public List<ValidatorId> missingValidators(MessageKind kind) {
        if (kind == MessageKind.PREPARE_REQUEST) {
            Optional<ValidatorId> primary = primary();
            if (primary.isEmpty() || hasCurrent(MessageKind.PREPARE_REQUEST, primary.get())) return List.of();
            return List.of(primary.get());
        }
        List<ValidatorId> exp = expected.get(kind);
        if (exp == null) return List.of();
        return without(exp, responders(kind));
    }

    /**
     * Records {@code message}, or rejects it without touching any state.
     *
     * @throws ConsensusException.InvalidHeight if the message is for another height
     * @throws ConsensusException.UnknownValidator if the sender is not in the roster
     * @throws ConsensusException.InvalidView if the message is for a view this state has not reached
     * @throws ConsensusException.InvalidPrimary if a prepare request does not come from the primary
     * @throws ConsensusException.ProposalMismatch if the message votes for a different proposal
     * @throws ConsensusException.MissingPrepareResponse if a commit arrives before the sender's prepare response
     */
    public void record(SignedMessage message) throws ConsensusException {
        if (message.height() != height) throw new ConsensusException.InvalidHeight(height, message.height());
        ValidatorId sender = message.validator();
        if (!validators.contains(sender)) throw new ConsensusException.UnknownValidator(sender);
        if (message.view().isAfter(view)) throw new ConsensusException.InvalidView(view, message.view());

        boolean current = message.view().equals(view);
        MessageKind kind = message.kind();
        if (current) {
            switch (kind) {
                case PREPARE_REQUEST -> {
                    ValidatorId primary = primary().orElseThrow(() -> new ConsensusException.UnknownValidator(sender));
                    if (!primary.equals(sender)) throw new ConsensusException.InvalidPrimary(primary, sender);
                    checkProposal(message.message());
                }
                case PREPARE_RESPONSE -> checkProposal(message.message());
                case COMMIT -> {
                    if (!hasPrepared(sender)) throw new ConsensusException.MissingPrepareResponse(sender);
                }
                default -> { }
            }
        }

        List<SignedMessage> list = records.computeIfAbsent(kind, k -> new ArrayList<>());
        int at = indexOf(list, sender);
        if (at >= 0) {
            // never let an older view overwrite what is on file
            if (list.get(at).view().isAfter(message.view())) return;
            list.set(at, message);
        } else {
            list.add(message);
        }
        if (!current) return;

        if (proposal == null) {
            proposal = message.message().proposalHash().orElse(null);
        }
        if (kind == MessageKind.CHANGE_VIEW) {
            noteChangeView(sender, ((ChangeView) message.message()).reason());
        }
        expected.computeIfAbsent(kind, k -> validators.ids());
    }

    /**
     * Evaluates the votes of the current view. A change-view quorum preempts everything, then
     * commits are checked before prepare responses since they are the later-stage evidence.
     */
    public QuorumDecision quorumDecision() {
        if (validators.isEmpty()) return QuorumDecision.PENDING;
        int m = validators.quorum();

        Set<ValidatorId> changers = responders(MessageKind.CHANGE_VIEW);
        if (changers.size() >= m) {
            return new QuorumDecision.ViewChange(view.next(), without(validators.ids(), changers));
        }
        if (proposal == null) return QuorumDecision.PENDING;

        Set<ValidatorId> committers = responders(MessageKind.COMMIT);
        if (committers.size() >= m) {
            return new QuorumDecision.Proposal(MessageKind.COMMIT, proposal, missingFor(MessageKind.COMMIT, committers));
        }
        Set<ValidatorId> preparers = preparationResponders();
        if (preparers.size() >= m) {
            return new QuorumDecision.Proposal(MessageKind.PREPARE_RESPONSE, proposal,
                    missingFor(MessageKind.PREPARE_RESPONSE, preparers));
        }
        return QuorumDecision.PENDING;
    }

    /**
     * Moves to {@code newView} at the same height, dropping the evidence of the views before it.
     * The change views of the view being left are kept aside so a recovery message can carry them
     * to validators still in that view.
     */
    public void applyViewChange(ViewNumber newView) {
        if (!newView.isAfter(view)) {
            throw new IllegalArgumentException("view change must move forward: " + view + " -> " + newView);
        }
        lastChangeViews.clear();
        lastChangeViews.addAll(current(MessageKind.CHANGE_VIEW));
        view = newView;
        records.keySet().removeIf(MessageKind::viewScoped);
        resetViewData();
    }

    /** Starts over at {@code newHeight}, view zero. */
    public void advanceHeight(long newHeight) throws ConsensusException.InvalidHeight {
        if (newHeight <= height) throw new ConsensusException.InvalidHeight(height + 1, newHeight);
        height = newHeight;
        view = ViewNumber.ZERO;
        records.clear();
        lastChangeViews.clear();
        resetViewData();
    }

    /**
     * Compacts what this state holds for the current view, for a validator that is catching up.
     * The change views that led into the current view come first, stamped with the view they were
     * sent in, so a validator one view behind reaches the same view change before the rest applies.
     */
    public RecoveryMessage toRecoveryMessage() {
        List<ChangeViewCompact> changeViews = new ArrayList<>();
        for (SignedMessage m : lastChangeViews) changeViews.add(compact(m));
        for (SignedMessage m : current(MessageKind.CHANGE_VIEW)) changeViews.add(compact(m));
        PrepareRequestCompact request = null;
        for (SignedMessage m : current(MessageKind.PREPARE_REQUEST)) {
            request = new PrepareRequestCompact(m.validator(), (PrepareRequest) m.message(), m.signature());
        }
        List<PreparationCompact> preparations = new ArrayList<>();
        for (SignedMessage m : current(MessageKind.PREPARE_RESPONSE)) {
            preparations.add(new PreparationCompact(m.validator(), m.signature()));
        }
        List<CommitCompact> commits = new ArrayList<>();
        for (SignedMessage m : current(MessageKind.COMMIT)) {
            commits.add(new CommitCompact(m.validator(), m.view(), ((Commit) m.message()).signature(), m.signature()));
        }
        Hash256 preparationHash = request == null ? proposal : null;
        return new RecoveryMessage(changeViews, request, preparationHash, preparations, commits);
    }

    public SnapshotState snapshot() {
        return new SnapshotState(height, view, validators.asList(), records, expected, proposal,
                changeViewReasons, changeViewReasonCounts, changeViewTotal, lastChangeViews);
    }

    /**
     * Rebuilds a state from {@code snapshot} against {@code validators}, which may differ from the
     * roster the snapshot was taken with as long as every validator it references is present.
     *
     * @throws ConsensusException.UnknownValidator if the snapshot references a validator not in {@code validators}
     * @throws ConsensusException.InvalidHeight if a recorded message belongs to another height
     */
    public static ConsensusState fromSnapshot(ValidatorSet validators, SnapshotState snapshot) throws ConsensusException {
        for (List<ValidatorId> ids : snapshot.expected().values()) {
            for (ValidatorId id : ids) requireKnown(validators, id);
        }
        for (List<SignedMessage> list : snapshot.records().values()) {
            for (SignedMessage m : list) {
                requireKnown(validators, m.validator());
                if (m.height() != snapshot.height()) throw new ConsensusException.InvalidHeight(snapshot.height(), m.height());
            }
        }
        for (SignedMessage m : snapshot.lastChangeViews()) {
            requireKnown(validators, m.validator());
            if (m.height() != snapshot.height()) throw new ConsensusException.InvalidHeight(snapshot.height(), m.height());
        }
        for (ValidatorId id : snapshot.changeViewReasons().keySet()) requireKnown(validators, id);

        ConsensusState state = new ConsensusState(snapshot.height(), snapshot.view(), validators);
        snapshot.records().forEach((k, v) -> state.records.put(k, new ArrayList<>(v)));
        snapshot.expected().forEach((k, v) -> state.expected.put(k, new ArrayList<>(v)));
        state.proposal = snapshot.proposal();
        state.changeViewReasons.putAll(snapshot.changeViewReasons());
        state.changeViewReasonCounts.putAll(snapshot.changeViewReasonCounts());
        state.changeViewTotal = snapshot.changeViewTotal();
        state.lastChangeViews.addAll(snapshot.lastChangeViews());
        return state;
    }

    private static void requireKnown(ValidatorSet validators, ValidatorId id) throws ConsensusException.UnknownValidator {
        if (!validators.contains(id)) throw new ConsensusException.UnknownValidator(id);
    }

    private static ChangeViewCompact compact(SignedMessage m) {
        ChangeView cv = (ChangeView) m.message();
        return new ChangeViewCompact(m.validator(), m.view(), cv.reason(), cv.timestamp(), m.signature());
    }

    private void checkProposal(ConsensusMessage message) throws ConsensusException.ProposalMismatch {
        Optional<Hash256> hash = message.proposalHash();
        if (proposal != null && hash.isPresent() && !proposal.equals(hash.get())) {
            throw new ConsensusException.ProposalMismatch(proposal, hash.get());
        }
    }

    /** A prepare response on file, or the primary's own prepare request standing in for one. */
    private boolean hasPrepared(ValidatorId v) {
        if (hasCurrent(MessageKind.PREPARE_RESPONSE, v)) return true;
        return primary().map(p -> p.equals(v)).orElse(false) && hasCurrent(MessageKind.PREPARE_REQUEST, v);
    }

    private void noteChangeView(ValidatorId v, ChangeViewReason reason) {
        ChangeViewReason previous = changeViewReasons.put(v, reason);
        if (previous == null) {
            changeViewTotal++;
        } else {
            changeViewReasonCounts.computeIfPresent(previous, (r, c) -> c > 1 ? c - 1 : null);
        }
        changeViewReasonCounts.merge(reason, 1, Integer::sum);
    }

    private void resetViewData() {
        proposal = null;
        expected.clear();
        changeViewReasons.clear();
        changeViewReasonCounts.clear();
        changeViewTotal = 0;
    }

    private boolean hasCurrent(MessageKind kind, ValidatorId v) {
        for (SignedMessage m : current(kind)) {
            if (m.validator().equals(v)) return true;
        }
        return false;
    }

    private List<SignedMessage> current(MessageKind kind) {
        List<SignedMessage> list = records.get(kind);
        if (list == null) return List.of();
        List<SignedMessage> out = new ArrayList<>(list.size());
        for (SignedMessage m : list) {
            if (m.view().equals(view)) out.add(m);
        }
        return out;
    }

    private Set<ValidatorId> responders(MessageKind kind) {
        Set<ValidatorId> out = new LinkedHashSet<>();
        for (SignedMessage m : current(kind)) out.add(m.validator());
        return out;
    }

    private Set<ValidatorId> preparationResponders() {
        Set<ValidatorId> out = responders(MessageKind.PREPARE_RESPONSE);
        Optional<ValidatorId> primary = primary();
        if (primary.isPresent() && hasCurrent(MessageKind.PREPARE_REQUEST, primary.get())) out.add(primary.get());
        return out;
    }

    private List<ValidatorId> missingFor(MessageKind kind, Set<ValidatorId> responders) {
        List<ValidatorId> base = expected.get(kind);
        return without(base == null ? validators.ids() : base, responders);
    }

    private static List<ValidatorId> without(List<ValidatorId> ids, Set<ValidatorId> present) {
        List<ValidatorId> out = new ArrayList<>();
        for (ValidatorId id : ids) {
            if (!present.contains(id)) out.add(id);
        }
        return out;
    }

    private static int indexOf(List<SignedMessage> list, ValidatorId v) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).validator().equals(v)) return i;
        }
        return -1;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConsensusState s)) return false;
        return height == s.height
                && changeViewTotal == s.changeViewTotal
                && view.equals(s.view)
                && validators.equals(s.validators)
                && records.equals(s.records)
                && expected.equals(s.expected)
                && Objects.equals(proposal, s.proposal)
                && changeViewReasons.equals(s.changeViewReasons)
                && changeViewReasonCounts.equals(s.changeViewReasonCounts)
                && lastChangeViews.equals(s.lastChangeViews);
    }

    @Override public int hashCode() {
        return Objects.hash(height, view, validators, records, expected, proposal, changeViewTotal);
    }

    @Override public String toString() {
        return "ConsensusState{h=" + height + ", v=" + view + ", proposal=" + proposal + ", tallies=" + tallies() + "}";
    }
}
