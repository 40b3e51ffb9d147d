package dbft.consensus.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import dbft.common.config.ConsensusConfig;
import dbft.common.crypto.KeyFiles;
import dbft.consensus.persistence.FileColumnStore;
import dbft.consensus.validator.Validator;
import dbft.consensus.validator.ValidatorId;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServiceContextTest {

    @TempDir
    Path dir;

    private KeyPair writeKeys(int id) throws Exception {
        KeyPair kp = KeyFiles.generateKeyPair();
        Path base = dir.resolve("validators").resolve("v" + id);
        KeyFiles.writeKeyPair(base.resolve(KeyFiles.PRIVATE_KEY_FILE), base.resolve(KeyFiles.PUBLIC_KEY_FILE), kp);
        return kp;
    }

    private ConsensusConfig config(String snapshotDir) throws Exception {
        Path json = dir.resolve("consensus.json");
        Files.writeString(json, """
                {"network": 7, "blockTimeMs": 1000, "maxViewTimeoutMs": 16000, %s
                 "validators": [
                   {"id": 0, "alias": "alpha", "publicKeyPath": "validators/v0/secp256r1.pub"},
                   {"id": 1, "publicKeyPath": "validators/v1/secp256r1.pub"}
                 ]}
                """.formatted(snapshotDir == null ? "" : "\"snapshotDir\": \"" + snapshotDir + "\","));
        return ConsensusConfig.load(json);
    }

    @Test
    void wiresRosterStoreAndTimingFromConfig() throws Exception {
        KeyPair self = writeKeys(0);
        writeKeys(1);

        ServiceContext ctx = ServiceContext.fromConfig(config("snapshots"), dir, ValidatorId.of(0), self.getPrivate(),
                mock(ConsensusNetwork.class), mock(BlockExecutor.class));

        assertThat(ctx.validators.size()).isEqualTo(2);
        assertThat(ctx.validators.get(ValidatorId.of(0)).flatMap(Validator::aliasOpt)).contains("alpha");
        assertThat(ctx.snapshotKey.network()).isEqualTo(7);
        assertThat(ctx.blockTimeMs).isEqualTo(1000);
        assertThat(ctx.maxViewTimeoutMs).isEqualTo(16000);
        assertThat(((FileColumnStore) ctx.store).root()).isEqualTo(dir.resolve("snapshots"));
    }

    @Test
    void snapshotDirDefaultsUnderConfigDir() throws Exception {
        KeyPair self = writeKeys(0);
        writeKeys(1);

        ServiceContext ctx = ServiceContext.fromConfig(config(null), dir, ValidatorId.of(1), self.getPrivate(),
                mock(ConsensusNetwork.class), mock(BlockExecutor.class));

        assertThat(((FileColumnStore) ctx.store).root()).isEqualTo(dir.resolve(ServiceContext.DEFAULT_SNAPSHOT_DIR));
    }

    @Test
    void selfMustBeInTheRoster() throws Exception {
        KeyPair self = writeKeys(0);
        writeKeys(1);
        ConsensusConfig config = config(null);

        assertThatThrownBy(() -> ServiceContext.fromConfig(config, dir, ValidatorId.of(5), self.getPrivate(),
                mock(ConsensusNetwork.class), mock(BlockExecutor.class)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("v5");
    }
}
