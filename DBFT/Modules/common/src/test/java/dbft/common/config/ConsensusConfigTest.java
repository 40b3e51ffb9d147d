package dbft.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dbft.common.crypto.KeyFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConsensusConfigTest {

    @TempDir
    Path dir;

    @Test
    void loadsValidatorsAndDefaults() throws Exception {
        Path cfg = write("""
                {
                  "network": 860833102,
                  "validators": [
                    {"id": 0, "alias": "alpha", "publicKeyPath": "keys/v0.pub"},
                    {"id": 1, "pubkeyPemPath": "keys/v1.pub"}
                  ],
                  "somethingElse": true
                }
                """);

        ConsensusConfig config = ConsensusConfig.load(cfg);

        assertThat(config.network).isEqualTo(860833102L);
        assertThat(config.blockTimeMs).isEqualTo(15_000L);
        assertThat(config.maxViewTimeoutMs).isEqualTo(240_000L);
        assertThat(config.validators).hasSize(2);
        assertThat(config.validators.get(0).alias).isEqualTo("alpha");
        assertThat(config.validators.get(1).publicKeyPath).isEqualTo("keys/v1.pub");
    }

    @Test
    void rejectsDuplicateIds() throws Exception {
        Path cfg = write("""
                {"network": 1, "validators": [
                  {"id": 3, "publicKeyPath": "a.pub"},
                  {"id": 3, "publicKeyPath": "b.pub"}
                ]}
                """);

        assertThatThrownBy(() -> ConsensusConfig.load(cfg))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("duplicate validator id 3");
    }

    @Test
    void rejectsEmptyRosterAndBadTimeouts() throws Exception {
        assertThatThrownBy(() -> ConsensusConfig.load(write("{\"network\": 1, \"validators\": []}")))
                .hasMessageContaining("validators list empty");
        assertThatThrownBy(() -> ConsensusConfig.load(write("""
                {"network": 1, "blockTimeMs": 1000, "maxViewTimeoutMs": 10,
                 "validators": [{"id": 0, "publicKeyPath": "a.pub"}]}
                """)))
                .hasMessageContaining("maxViewTimeoutMs");
    }

    @Test
    void keyStoreResolvesPathsAgainstBaseDir() throws Exception {
        KeyPair kp = KeyFiles.generateKeyPair();
        KeyFiles.writeKeyPair(dir.resolve("keys/v0.key"), dir.resolve("keys/v0.pub"), kp);
        ConsensusConfig config = ConsensusConfig.load(write("""
                {"network": 1, "validators": [{"id": 0, "publicKeyPath": "keys/v0.pub"}]}
                """));

        KeyStore keys = KeyStore.from(config, dir);

        assertThat(keys.validatorCount()).isEqualTo(1);
        assertThat(keys.validatorKey(0)).contains(kp.getPublic());
        assertThat(keys.validatorKey(1)).isEmpty();
    }

    private Path write(String json) throws Exception {
        Path p = Files.createTempFile(dir, "consensus", ".json");
        Files.writeString(p, json);
        return p;
    }
}
