package dbft.consensus.persistence;

import static dbft.consensus.TestValidators.id;
import static dbft.consensus.TestValidators.unsigned;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dbft.consensus.TestValidators;
import dbft.consensus.core.ConsensusState;
import dbft.consensus.message.ChangeViewReason;
import dbft.consensus.message.ConsensusMessage.ChangeView;
import dbft.consensus.message.ConsensusMessage.PrepareRequest;
import dbft.consensus.message.ConsensusMessage.PrepareResponse;
import dbft.consensus.message.ConsensusMessage.RecoveryRequest;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageCodec.CodecException;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.ValidatorSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class ConsensusPersistenceTest {

    private static final TestValidators VALIDATORS = TestValidators.create(4);
    private static final Hash256 BLOCK = Hash256.hash(new byte[] {3});
    private static final SnapshotKey KEY = new SnapshotKey(TestValidators.NETWORK);

    @TempDir
    static Path dir;

    static Stream<ColumnStore> stores() throws IOException {
        return Stream.of(new MemoryColumnStore(), new FileColumnStore(dir.resolve("store-" + System.nanoTime())));
    }

    private static ConsensusState busyState() throws Exception {
        ConsensusState state = new ConsensusState(1, ViewNumber.ZERO, VALIDATORS.set());
        state.record(unsigned(3, 1, 0, new RecoveryRequest(11L)));
        state.record(unsigned(0, 1, 0, new ChangeView(ChangeViewReason.TIMEOUT, 5L)));
        state.applyViewChange(ViewNumber.of(1));
        state.record(unsigned(0, 1, 0, new ChangeView(ChangeViewReason.TIMEOUT, 5L)));
        state.record(unsigned(2, 1, 1, new PrepareRequest(BLOCK, 1, List.of(Hash256.hash(new byte[] {9})))));
        state.record(unsigned(3, 1, 1, new PrepareResponse(BLOCK)));
        state.record(unsigned(1, 1, 1, new ChangeView(ChangeViewReason.TX_INVALID)));
        return state;
    }

    @ParameterizedTest
    @MethodSource("stores")
    void missingSnapshotLoadsNothing(ColumnStore store) throws Exception {
        assertThat(ConsensusPersistence.loadEngine(store, KEY)).isEmpty();
        assertThat(ConsensusPersistence.loadEngine(store, KEY, VALIDATORS.set())).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("stores")
    void persistedStateComesBackEqual(ColumnStore store) throws Exception {
        ConsensusState state = busyState();

        ConsensusPersistence.persistEngine(store, KEY, state);
        Optional<LoadedEngine> loaded = ConsensusPersistence.loadEngine(store, KEY, VALIDATORS.set());

        assertThat(loaded).hasValueSatisfying(l -> {
            assertThat(l.state()).isEqualTo(state);
            assertThat(l.state().quorumDecision()).isEqualTo(state.quorumDecision());
            assertThat(l.state().changeViewReasonCount(ChangeViewReason.TX_INVALID)).isEqualTo(1);
            assertThat(l.state().lastChangeViews()).singleElement()
                    .satisfies(m -> assertThat(m.view()).isEqualTo(ViewNumber.ZERO));
        });
    }

    @ParameterizedTest
    @MethodSource("stores")
    void persistedRosterIsUsedWhenNoneIsGiven(ColumnStore store) throws Exception {
        ConsensusPersistence.persistEngine(store, KEY, busyState());

        LoadedEngine loaded = ConsensusPersistence.loadEngine(store, KEY).orElseThrow();

        assertThat(loaded.validators()).isEqualTo(VALIDATORS.set());
        assertThat(loaded.validators().at(2).aliasOpt()).contains("node-2");
        assertThat(loaded.state().view()).isEqualTo(ViewNumber.of(1));
    }

    @ParameterizedTest
    @MethodSource("stores")
    void clearRemovesTheSnapshot(ColumnStore store) throws Exception {
        ConsensusPersistence.persistEngine(store, KEY, busyState());

        ConsensusPersistence.clearSnapshot(store, KEY);

        assertThat(ConsensusPersistence.loadEngine(store, KEY)).isEmpty();
        ConsensusPersistence.clearSnapshot(store, KEY);
    }

    @Test
    void snapshotIsKeyedByLittleEndianNetwork() throws Exception {
        MemoryColumnStore store = new MemoryColumnStore();

        ConsensusPersistence.persistEngine(store, KEY, busyState());

        assertThat(KEY.toBytes()).containsExactly(0x4e, 0x45, 0x4f, 0x33);
        assertThat(store.get(SnapshotKey.COLUMN, new byte[] {0x4e, 0x45, 0x4f, 0x33})).isPresent();
        assertThat(ConsensusPersistence.loadEngine(store, new SnapshotKey(1))).isEmpty();
        assertThat(store.size(SnapshotKey.COLUMN)).isEqualTo(1);
    }

    @Test
    void snapshotThatDoesNotFitTheRosterIsRefused() throws Exception {
        MemoryColumnStore store = new MemoryColumnStore();
        ConsensusPersistence.persistEngine(store, KEY, busyState());
        ValidatorSet smaller = new ValidatorSet(VALIDATORS.set().asList().subList(0, 3));

        assertThatThrownBy(() -> ConsensusPersistence.loadEngine(store, KEY, smaller))
                .isInstanceOfSatisfying(PersistenceException.class,
                        e -> assertThat(e.kind()).isEqualTo(PersistenceException.Kind.SNAPSHOT))
                .hasMessageContaining(id(3).toString());
    }

    @Test
    void corruptSnapshotIsReportedAsSnapshotError() throws Exception {
        MemoryColumnStore store = new MemoryColumnStore();
        store.put(SnapshotKey.COLUMN, KEY.toBytes(), new byte[] {1, 2, 3});

        assertThatThrownBy(() -> ConsensusPersistence.loadEngine(store, KEY))
                .isInstanceOfSatisfying(PersistenceException.class,
                        e -> assertThat(e.kind()).isEqualTo(PersistenceException.Kind.SNAPSHOT));
    }

    @Test
    void unknownSnapshotVersionIsRejected() throws Exception {
        byte[] bytes = SnapshotCodec.encode(busyState().snapshot());
        bytes[0] = 9;

        assertThatThrownBy(() -> SnapshotCodec.decode(bytes)).hasMessageContaining("version 9");
    }

    @Test
    void changeViewTotalThatWrapsNegativeIsRejected() {
        byte[] bytes = SnapshotCodec.encode(new ConsensusState(1, ViewNumber.ZERO, VALIDATORS.set()).snapshot());
        // an empty state ends with changeViewTotal = 0 and no last change views
        byte[] tampered = Arrays.copyOf(bytes, bytes.length + 4);
        byte[] tail = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x0F, 0x00};
        System.arraycopy(tail, 0, tampered, bytes.length - 2, tail.length);

        assertThatThrownBy(() -> SnapshotCodec.decode(tampered))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("change view total");
    }

    @Test
    void storeFailuresAreReportedAsStoreErrors() throws Exception {
        ColumnStore broken = mock(ColumnStore.class);
        when(broken.get(anyString(), any())).thenThrow(new IOException("disk gone"));
        doThrow(new IOException("read-only")).when(broken).put(anyString(), any(), any());

        assertThatThrownBy(() -> ConsensusPersistence.loadEngine(broken, KEY))
                .isInstanceOfSatisfying(PersistenceException.class,
                        e -> assertThat(e.kind()).isEqualTo(PersistenceException.Kind.STORE))
                .hasRootCauseMessage("disk gone");
        assertThatThrownBy(() -> ConsensusPersistence.persistEngine(broken, KEY, busyState()))
                .isInstanceOfSatisfying(PersistenceException.class,
                        e -> assertThat(e.kind()).isEqualTo(PersistenceException.Kind.STORE));
    }

    @Test
    void networkMustFitInU32() {
        assertThatThrownBy(() -> new SnapshotKey(0x1_0000_0000L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnapshotKey(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fileStoreSurvivesReopening() throws Exception {
        Path root = dir.resolve("reopen");
        ConsensusPersistence.persistEngine(new FileColumnStore(root), KEY, busyState());

        FileColumnStore reopened = new FileColumnStore(root);

        assertThat(ConsensusPersistence.loadEngine(reopened, KEY, VALIDATORS.set())).isPresent();
        assertThat(root.resolve(SnapshotKey.COLUMN).resolve("4e454f33")).exists();
    }
}
