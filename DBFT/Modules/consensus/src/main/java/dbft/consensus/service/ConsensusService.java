package dbft.consensus.service;

import com.google.protobuf.ByteString;
import dbft.consensus.core.ConsensusException;
import dbft.consensus.core.ConsensusState;
import dbft.consensus.core.DbftEngine;
import dbft.consensus.core.QuorumDecision;
import dbft.consensus.core.SnapshotState;
import dbft.consensus.message.ChangeViewReason;
import dbft.consensus.message.ConsensusMessage;
import dbft.consensus.message.ConsensusMessage.ChangeView;
import dbft.consensus.message.ConsensusMessage.Commit;
import dbft.consensus.message.ConsensusMessage.PrepareRequest;
import dbft.consensus.message.ConsensusMessage.PrepareResponse;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.MessageKind;
import dbft.consensus.message.SignedMessage;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.persistence.ConsensusPersistence;
import dbft.consensus.persistence.LoadedEngine;
import dbft.consensus.persistence.PersistenceException;
import dbft.consensus.validator.Validator;
import dbft.consensus.validator.ValidatorId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link DbftEngine} for one validator. All engine access happens on a single consensus
 * thread; inbound messages, timer expiries and shutdown are queued onto it.
 */
public final class ConsensusService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConsensusService.class);
    private static final long STOP_TIMEOUT_MS = 5_000L;

    private final ServiceContext ctx;
    private final boolean verifyBeforeEnqueue;
    private final ExecutorService exec;
    private final ViewTimers timers;
    private volatile boolean running;

    // consensus thread only
    private DbftEngine engine;
    private ViewNumber responseSentView;
    private ViewNumber commitSentView;
    private long lastExecutedHeight = -1;

    public ConsensusService(ServiceContext ctx) {
        this(ctx, false);
    }

    public ConsensusService(ServiceContext ctx, boolean verifyBeforeEnqueue) {
        this.ctx = ctx;
        this.verifyBeforeEnqueue = verifyBeforeEnqueue;
        this.exec = Executors.newSingleThreadExecutor(new NamedTF(ctx.self + "-dbft"));
        this.timers = new ViewTimers(ctx.self.toString(), ctx.blockTimeMs, ctx.maxViewTimeoutMs, this::onViewTimeout);
    }

    /**
     * Resumes from the stored snapshot, or starts at the executor's next height, then arms the
     * view timer and proposes if this node is the primary.
     * A service that failed to start is closed and cannot be started again.
     *
     * @throws PersistenceException if a stored snapshot cannot be read or does not fit the roster
     */
    public void start() throws PersistenceException {
        if (running) throw new IllegalStateException("already started");
        if (exec.isShutdown()) throw new IllegalStateException("consensus service is closed");
        Optional<LoadedEngine> loaded;
        try {
            loaded = ConsensusPersistence.loadEngine(ctx.store, ctx.snapshotKey, ctx.validators);
        } catch (PersistenceException e) {
            log.error("{} cannot start: {}", ctx.self, e.getMessage());
            release();
            throw e;
        }
        ConsensusState state = loaded.map(LoadedEngine::state)
                .orElseGet(() -> new ConsensusState(ctx.blocks.nextHeight(), ViewNumber.ZERO, ctx.validators));
        engine = new DbftEngine(state, ctx.verifier);
        running = true;
        log.info("{} starting at h={} v={} (resumed={}, primary={})", ctx.self, state.height(), state.view(),
                loaded.isPresent(), state.primary().orElse(null));
        exec.execute(() -> {
            timers.arm(engine.state().height(), engine.state().view());
            proposeIfPrimary();
        });
    }

    /**
     * Queues {@code message} for the engine. The future completes with the decision the message led
     * to, or exceptionally with the {@link ConsensusException} it was rejected with.
     */
    public CompletableFuture<QuorumDecision> submit(SignedMessage message) {
        CompletableFuture<QuorumDecision> out = new CompletableFuture<>();
        if (!running) {
            out.completeExceptionally(new IllegalStateException("consensus service is not running"));
            return out;
        }
        if (verifyBeforeEnqueue) {
            try {
                preVerify(message);
            } catch (ConsensusException e) {
                log.debug("Dropped {} before enqueue: {}", message, e.getMessage());
                out.completeExceptionally(e);
                return out;
            }
        }
        try {
            exec.execute(() -> {
                try {
                    out.complete(handle(message));
                } catch (ConsensusException e) {
                    log.debug("Rejected {}: {}", message, e.getMessage());
                    out.completeExceptionally(e);
                } catch (RuntimeException e) {
                    log.error("Consensus task failed for {}", message, e);
                    out.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            out.completeExceptionally(e);
        }
        return out;
    }

    /** A copy of the engine state, taken on the consensus thread. */
    public CompletableFuture<SnapshotState> snapshot() {
        return CompletableFuture.supplyAsync(() -> engine.snapshot(), exec);
    }

    public boolean isRunning() { return running; }

    /**
     * Persists the current state and stops the consensus thread and timers. A service that was
     * never started only releases its threads.
     */
    public void stop() {
        if (!running) {
            release();
            return;
        }
        running = false;
        timers.close();
        try {
            exec.submit(this::persist).get(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.error("{} could not persist on stop", ctx.self, e);
        }
        release();
        log.info("{} stopped", ctx.self);
    }

    @Override
    public void close() { stop(); }

    private QuorumDecision handle(SignedMessage message) throws ConsensusException {
        ViewNumber view = engine.state().view();
        QuorumDecision decision = engine.processMessage(message);
        long height = engine.state().height();
        // a recovery message can move the view and still report a later decision
        if (engine.state().view().isAfter(view)) onViewChanged(engine.state().view());
        if (!(decision instanceof QuorumDecision.ViewChange)) react(decision);
        // a finalized block moves the engine on; nothing left to answer for the old height
        if (!message.validator().equals(ctx.self) && engine.state().height() == height) {
            answer(message);
        }
        return decision;
    }

    private void answer(SignedMessage message) {
        ConsensusState state = engine.state();
        switch (message.kind()) {
            case PREPARE_REQUEST -> {
                if (message.view().equals(state.view()) && !state.view().equals(responseSentView)) {
                    PrepareRequest request = (PrepareRequest) message.message();
                    responseSentView = state.view();
                    send(new PrepareResponse(request.proposal()));
                }
            }
            case RECOVERY_REQUEST -> {
                SignedMessage recovery = sign(engine.buildRecoveryMessage());
                if (recovery != null) ctx.network.broadcast(recovery);
            }
            default -> { }
        }
    }

    private void react(QuorumDecision decision) {
        if (decision instanceof QuorumDecision.ViewChange vc) {
            onViewChanged(vc.newView());
        } else if (decision instanceof QuorumDecision.Proposal p) {
            if (p.kind() == MessageKind.COMMIT) {
                onCommitted(p.proposal());
            } else if (p.kind() == MessageKind.PREPARE_RESPONSE) {
                onPrepared(p.proposal());
            }
        }
    }

    private void onPrepared(Hash256 proposal) {
        ViewNumber view = engine.state().view();
        if (view.equals(commitSentView)) return;
        commitSentView = view;
        ByteString blockSignature;
        try {
            blockSignature = ctx.signer.sign(proposal.bytes());
        } catch (GeneralSecurityException e) {
            log.error("{} failed to sign block {} at h={}", ctx.self, proposal, engine.state().height(), e);
            return;
        }
        long height = engine.state().height();
        log.info("{} prepared {} at h={} v={}, committing", ctx.self, proposal, height, view);
        send(new Commit(blockSignature));
        if (engine.state().height() == height) persist();
    }

    private void onCommitted(Hash256 proposal) {
        ConsensusState state = engine.state();
        long height = state.height();
        if (height == lastExecutedHeight) return;
        lastExecutedHeight = height;

        Map<ValidatorId, ByteString> signatures = new TreeMap<>();
        for (SignedMessage m : state.records(MessageKind.COMMIT)) {
            if (m.view().equals(state.view())) signatures.put(m.validator(), ((Commit) m.message()).signature());
        }
        FinalizedBlock block = new FinalizedBlock(height, state.view(), proposal, signatures);
        log.info("{} finalized {} at h={} v={} with {} commit(s)", ctx.self, proposal, height, state.view(), signatures.size());
        ctx.blocks.execute(block);

        try {
            engine.advanceHeight(height + 1);
        } catch (ConsensusException.InvalidHeight e) {
            throw new IllegalStateException("height did not advance past " + height, e);
        }
        responseSentView = null;
        commitSentView = null;
        try {
            ConsensusPersistence.clearSnapshot(ctx.store, ctx.snapshotKey);
        } catch (PersistenceException e) {
            log.error("{} could not clear snapshot after h={}", ctx.self, height, e);
        }
        timers.arm(engine.state().height(), engine.state().view());
        proposeIfPrimary();
    }

    private void onViewChanged(ViewNumber newView) {
        long height = engine.state().height();
        log.info("{} moved to v={} at h={}", ctx.self, newView, height);
        ctx.network.onViewChanged(height, newView);
        persist();
        timers.arm(height, newView);
        proposeIfPrimary();
    }

    private void onViewTimeout(long height, ViewNumber view) {
        try {
            exec.execute(() -> {
                ConsensusState state = engine.state();
                if (state.height() != height || !state.view().equals(view)) return;
                log.warn("{} timed out in v={} at h={} (primary={}), requesting change view",
                        ctx.self, view, height, state.primary().orElse(null));
                send(new ChangeView(ChangeViewReason.TIMEOUT, System.currentTimeMillis()));
                if (engine.state().height() == height && engine.state().view().equals(view)) {
                    timers.arm(height, view, timers.timeoutFor(view.next()));
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("{} ignored timeout at h={} v={}: service stopped", ctx.self, height, view);
        }
    }

    private void proposeIfPrimary() {
        ConsensusState state = engine.state();
        if (!state.primary().map(ctx.self::equals).orElse(false)) return;
        boolean alreadyProposed = state.records(MessageKind.PREPARE_REQUEST).stream()
                .anyMatch(m -> m.validator().equals(ctx.self) && m.view().equals(state.view()));
        if (alreadyProposed) return;
        Optional<BlockProposal> block = ctx.blocks.propose(state.height());
        if (block.isEmpty()) {
            log.debug("{} has nothing to propose at h={}", ctx.self, state.height());
            return;
        }
        log.info("{} proposing {} at h={} v={}", ctx.self, block.get().hash(), state.height(), state.view());
        send(new PrepareRequest(block.get().hash(), state.height(), block.get().txHashes(),
                System.currentTimeMillis(), ThreadLocalRandom.current().nextLong()));
    }

    /** Signs {@code message} for the current (height, view), broadcasts it and feeds it to the local engine. */
    private void send(ConsensusMessage message) {
        SignedMessage signed = sign(message);
        if (signed == null) return;
        ctx.network.broadcast(signed);
        try {
            react(engine.processMessage(signed));
        } catch (ConsensusException e) {
            log.warn("{} rejected its own {}: {}", ctx.self, signed, e.getMessage());
        }
    }

    private SignedMessage sign(ConsensusMessage message) {
        ConsensusState state = engine.state();
        try {
            return SignedMessage.sign(state.height(), ctx.self, state.view(), message, ctx.signer);
        } catch (GeneralSecurityException e) {
            log.error("{} failed to sign {} at h={} v={}", ctx.self, message.kind(), state.height(), state.view(), e);
            return null;
        }
    }

    private void persist() {
        try {
            ConsensusPersistence.persistEngine(ctx.store, ctx.snapshotKey, engine.state());
        } catch (PersistenceException e) {
            log.error("{} could not persist snapshot at h={} v={}", ctx.self, engine.state().height(), engine.state().view(), e);
        }
    }

    private void release() {
        timers.close();
        exec.shutdown();
        try {
            if (!exec.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("{} consensus thread did not finish within {} ms", ctx.self, STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void preVerify(SignedMessage message) throws ConsensusException {
        Validator sender = ctx.validators.get(message.validator())
                .orElseThrow(() -> new ConsensusException.UnknownValidator(message.validator()));
        try {
            ctx.verifier.verify(message.digest(), message.signature(), sender.publicKey());
        } catch (GeneralSecurityException e) {
            throw new ConsensusException.InvalidSignature(message.validator());
        }
    }

    static final class NamedTF implements ThreadFactory {
        private final String base;
        NamedTF(String base) { this.base = base; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, base);
            t.setDaemon(true);
            return t;
        }
    }
}
