package dbft.consensus.validator;

import dbft.common.config.ConsensusConfig;
import dbft.common.config.KeyStore;
import dbft.consensus.message.ViewNumber;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable validator roster. A roster change is a new {@code ValidatorSet} and
 * a fresh consensus state; nothing mutates a set once it is built.
 */
public final class ValidatorSet implements Iterable<Validator> {
    private final List<Validator> validators;
    private final Map<ValidatorId, Integer> indexById;

    public ValidatorSet(List<Validator> validators) {
        List<Validator> copy = List.copyOf(validators);
        Map<ValidatorId, Integer> index = new HashMap<>(copy.size() * 2);
        for (int i = 0; i < copy.size(); i++) {
            Validator v = copy.get(i);
            if (index.putIfAbsent(v.id(), i) != null) {
                throw new IllegalArgumentException("duplicate validator id " + v.id());
            }
        }
        this.validators = copy;
        this.indexById = Collections.unmodifiableMap(index);
    }

    public static ValidatorSet fromConfig(ConsensusConfig config, KeyStore keys) {
        List<Validator> list = new ArrayList<>(config.validators.size());
        for (ConsensusConfig.Validator v : config.validators) {
            PublicKey pk = keys.validatorKey(v.id)
                    .orElseThrow(() -> new IllegalStateException("Trust invalid: no public key loaded for validator " + v.id));
            list.add(new Validator(ValidatorId.of(v.id), pk, v.alias));
        }
        return new ValidatorSet(list);
    }

    public int size() { return validators.size(); }

    public boolean isEmpty() { return validators.isEmpty(); }

    /** f: how many validators may be faulty, floor((N - 1) / 3). */
    public int faultTolerance() { return validators.isEmpty() ? 0 : (validators.size() - 1) / 3; }

    /** M = N - f votes are needed to finalize a proposal or a view change. */
    public int quorum() { return validators.size() - faultTolerance(); }

    public Optional<Validator> get(ValidatorId id) {
        Integer i = indexById.get(id);
        return i == null ? Optional.empty() : Optional.of(validators.get(i));
    }

    public Optional<Integer> indexOf(ValidatorId id) { return Optional.ofNullable(indexById.get(id)); }

    public boolean contains(ValidatorId id) { return indexById.containsKey(id); }

    public Validator at(int index) { return validators.get(index); }

    public Optional<ValidatorId> primaryId(long height, ViewNumber view) {
        if (validators.isEmpty()) return Optional.empty();
        long n = validators.size();
        int idx = (int) Long.remainderUnsigned(height + view.value(), n);
        return Optional.of(validators.get(idx).id());
    }

    public List<ValidatorId> ids() {
        List<ValidatorId> out = new ArrayList<>(validators.size());
        for (Validator v : validators) out.add(v.id());
        return out;
    }

    public List<Validator> asList() { return validators; }

    @Override public Iterator<Validator> iterator() { return validators.iterator(); }

    @Override public boolean equals(Object o) {
        return o instanceof ValidatorSet other && validators.equals(other.validators);
    }

    @Override public int hashCode() { return validators.hashCode(); }

    @Override public String toString() { return "ValidatorSet" + ids(); }
}
