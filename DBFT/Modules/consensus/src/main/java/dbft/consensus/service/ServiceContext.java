package dbft.consensus.service;

import dbft.common.config.ConsensusConfig;
import dbft.common.config.KeyStore;
import dbft.consensus.core.MessageSigner;
import dbft.consensus.core.Secp256r1Signer;
import dbft.consensus.core.Secp256r1Verifier;
import dbft.consensus.core.SignatureVerifier;
import dbft.consensus.persistence.ColumnStore;
import dbft.consensus.persistence.FileColumnStore;
import dbft.consensus.persistence.SnapshotKey;
import dbft.consensus.validator.ValidatorId;
import dbft.consensus.validator.ValidatorSet;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.Objects;

/** Everything a {@link ConsensusService} is wired to. */
public final class ServiceContext {
    public static final String DEFAULT_SNAPSHOT_DIR = "data";

    public final ValidatorId self;
    public final ValidatorSet validators;
    public final MessageSigner signer;
    public final SignatureVerifier verifier;
    public final ConsensusNetwork network;
    public final BlockExecutor blocks;
    public final ColumnStore store;
    public final SnapshotKey snapshotKey;
    public final long blockTimeMs;
    public final long maxViewTimeoutMs;

    public ServiceContext(ValidatorId self,
                          ValidatorSet validators,
                          MessageSigner signer,
                          SignatureVerifier verifier,
                          ConsensusNetwork network,
                          BlockExecutor blocks,
                          ColumnStore store,
                          SnapshotKey snapshotKey,
                          long blockTimeMs,
                          long maxViewTimeoutMs) {
        this.self = Objects.requireNonNull(self, "self");
        this.validators = Objects.requireNonNull(validators, "validators");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.network = Objects.requireNonNull(network, "network");
        this.blocks = Objects.requireNonNull(blocks, "blocks");
        this.store = Objects.requireNonNull(store, "store");
        this.snapshotKey = Objects.requireNonNull(snapshotKey, "snapshotKey");
        if (blockTimeMs <= 0) throw new IllegalArgumentException("blockTimeMs must be positive");
        if (maxViewTimeoutMs < blockTimeMs) throw new IllegalArgumentException("maxViewTimeoutMs must be >= blockTimeMs");
        if (!validators.contains(self)) throw new IllegalArgumentException(self + " is not in " + validators);
        this.blockTimeMs = blockTimeMs;
        this.maxViewTimeoutMs = maxViewTimeoutMs;
    }

    /**
     * Wires a validator from its configuration: roster keys and the snapshot directory resolve
     * against {@code configDir}, signatures are bound to the configured network.
     */
    public static ServiceContext fromConfig(ConsensusConfig config, Path configDir, ValidatorId self, PrivateKey key,
                                            ConsensusNetwork network, BlockExecutor blocks)
            throws IOException, GeneralSecurityException {
        ValidatorSet validators = ValidatorSet.fromConfig(config, KeyStore.from(config, configDir));
        String dir = config.snapshotDir == null || config.snapshotDir.isBlank() ? DEFAULT_SNAPSHOT_DIR : config.snapshotDir;
        return new ServiceContext(self, validators,
                new Secp256r1Signer(config.network, key),
                new Secp256r1Verifier(config.network),
                network, blocks,
                new FileColumnStore(configDir.resolve(dir)),
                new SnapshotKey(config.network),
                config.blockTimeMs, config.maxViewTimeoutMs);
    }
}
