package dbft.consensus.persistence;

import dbft.consensus.core.ConsensusException;
import dbft.consensus.core.ConsensusState;
import dbft.consensus.core.SnapshotState;
import dbft.consensus.message.MessageCodec.CodecException;
import dbft.consensus.validator.ValidatorSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Saves and restores consensus state in the {@value SnapshotKey#COLUMN} column. Each write replaces
 * the row for its network; there is no log to replay. Callers must not interleave these calls with
 * message processing on the same state.
 */
public final class ConsensusPersistence {
    private static final Logger log = LoggerFactory.getLogger(ConsensusPersistence.class);

    private ConsensusPersistence() {}

    public static void persistEngine(ColumnStore store, SnapshotKey key, ConsensusState state) throws PersistenceException {
        byte[] bytes = SnapshotCodec.encode(state.snapshot());
        try {
            store.put(SnapshotKey.COLUMN, key.toBytes(), bytes);
        } catch (IOException e) {
            throw PersistenceException.store("writing snapshot for network " + key.network() + " failed", e);
        }
        log.debug("Persisted snapshot for network {} at h={} v={} ({} bytes)", key.network(), state.height(), state.view(), bytes.length);
    }

    /** Restores against the roster stored in the snapshot. */
    public static Optional<LoadedEngine> loadEngine(ColumnStore store, SnapshotKey key) throws PersistenceException {
        Optional<SnapshotState> snapshot = read(store, key);
        if (snapshot.isEmpty()) return Optional.empty();
        ValidatorSet validators;
        try {
            validators = new ValidatorSet(snapshot.get().validators());
        } catch (IllegalArgumentException e) {
            throw PersistenceException.snapshot("snapshot roster for network " + key.network() + " is invalid", e);
        }
        return Optional.of(rebuild(key, validators, snapshot.get()));
    }

    /** Restores against the configured roster; a snapshot naming validators it lacks is refused. */
    public static Optional<LoadedEngine> loadEngine(ColumnStore store, SnapshotKey key, ValidatorSet validators)
            throws PersistenceException {
        Optional<SnapshotState> snapshot = read(store, key);
        if (snapshot.isEmpty()) return Optional.empty();
        return Optional.of(rebuild(key, validators, snapshot.get()));
    }

    public static void clearSnapshot(ColumnStore store, SnapshotKey key) throws PersistenceException {
        try {
            store.delete(SnapshotKey.COLUMN, key.toBytes());
        } catch (IOException e) {
            throw PersistenceException.store("clearing snapshot for network " + key.network() + " failed", e);
        }
        log.debug("Cleared snapshot for network {}", key.network());
    }

    private static Optional<SnapshotState> read(ColumnStore store, SnapshotKey key) throws PersistenceException {
        Optional<byte[]> raw;
        try {
            raw = store.get(SnapshotKey.COLUMN, key.toBytes());
        } catch (IOException e) {
            throw PersistenceException.store("reading snapshot for network " + key.network() + " failed", e);
        }
        if (raw.isEmpty()) return Optional.empty();
        try {
            return Optional.of(SnapshotCodec.decode(raw.get()));
        } catch (CodecException e) {
            throw PersistenceException.snapshot("snapshot for network " + key.network() + " is unreadable", e);
        }
    }

    private static LoadedEngine rebuild(SnapshotKey key, ValidatorSet validators, SnapshotState snapshot)
            throws PersistenceException {
        try {
            ConsensusState state = ConsensusState.fromSnapshot(validators, snapshot);
            log.info("Loaded snapshot for network {} at h={} v={}", key.network(), state.height(), state.view());
            return new LoadedEngine(validators, state);
        } catch (ConsensusException e) {
            throw PersistenceException.snapshot("snapshot for network " + key.network() + " does not fit the roster: " + e.getMessage(), e);
        }
    }
}
