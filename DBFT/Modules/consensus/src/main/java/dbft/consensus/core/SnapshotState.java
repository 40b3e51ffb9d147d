package dbft.consensus.core;

import dbft.consensus.message.ChangeViewReason;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.Validator;
import dbft.consensus.validator.ValidatorId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Durable, immutable projection of a {@link ConsensusState}. Self-sufficient: a node restarted
 * from it resumes mid-view without replaying anything.
 */
public record SnapshotState(long height,
                            ViewNumber view,
                            List<Validator> validators,
                            Map<MessageKind, List<SignedMessage>> records,
                            Map<MessageKind, List<ValidatorId>> expected,
                            Hash256 proposal,
                            Map<ValidatorId, ChangeViewReason> changeViewReasons,
                            Map<ChangeViewReason, Integer> changeViewReasonCounts,
                            int changeViewTotal,
                            List<SignedMessage> lastChangeViews) {

    public SnapshotState {
        Objects.requireNonNull(view, "view");
        validators = List.copyOf(validators);
        records = copyByKind(records);
        expected = copyByKind(expected);
        changeViewReasons = Collections.unmodifiableMap(new TreeMap<>(changeViewReasons));
        Map<ChangeViewReason, Integer> counts = new EnumMap<>(ChangeViewReason.class);
        counts.putAll(changeViewReasonCounts);
        changeViewReasonCounts = Collections.unmodifiableMap(counts);
        lastChangeViews = List.copyOf(lastChangeViews);
    }

    public Optional<Hash256> proposalOpt() { return Optional.ofNullable(proposal); }

    private static <T> Map<MessageKind, List<T>> copyByKind(Map<MessageKind, ? extends List<T>> in) {
        Map<MessageKind, List<T>> out = new EnumMap<>(MessageKind.class);
        for (var e : in.entrySet()) out.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        return Collections.unmodifiableMap(out);
    }
}
