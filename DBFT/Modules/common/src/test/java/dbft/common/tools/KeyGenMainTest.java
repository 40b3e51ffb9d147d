package dbft.common.tools;

import static org.assertj.core.api.Assertions.assertThat;

import dbft.common.crypto.KeyFiles;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class KeyGenMainTest {

    @TempDir
    Path dir;

    @Test
    void batchWritesOneKeyPairPerValidator() throws Exception {
        int exit = new CommandLine(new KeyGenMain()).execute("--out", dir.toString(), "--batch", "3");

        assertThat(exit).isZero();
        for (int i = 0; i < 3; i++) {
            Path base = dir.resolve("validators").resolve("v" + i);
            assertThat(base.resolve(KeyFiles.PRIVATE_KEY_FILE)).exists();
            assertThat(KeyFiles.loadPublicKeyPem(base.resolve(KeyFiles.PUBLIC_KEY_FILE))).isNotNull();
        }
    }

    @Test
    void singleKeyPairGoesToOut() {
        int exit = new CommandLine(new KeyGenMain()).execute("--out", dir.toString(), "--id", "alpha");

        assertThat(exit).isZero();
        assertThat(dir.resolve(KeyFiles.PUBLIC_KEY_FILE)).exists();
    }

    @Test
    void negativeBatchFails() {
        assertThat(new CommandLine(new KeyGenMain()).execute("--out", dir.toString(), "--batch=-1")).isEqualTo(2);
    }

    @Test
    void missingOutIsAUsageError() {
        assertThat(new CommandLine(new KeyGenMain()).execute()).isEqualTo(2);
    }
}
