package dbft.common.tools;

import dbft.common.crypto.KeyFiles;
import picocli.CommandLine;

import java.nio.file.Path;
import java.security.KeyPair;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "keygen", mixinStandardHelpOptions = true,
        description = "Generate secp256r1 keypairs for consensus validators.")
public class KeyGenMain implements Callable<Integer> {

    @CommandLine.Option(names = "--out", description = "Output directory (e.g., secrets/validators/v0)", required = true)
    Path outDir;

    @CommandLine.Option(names = "--id", description = "Validator alias. Only used for print/log", required = false)
    String id;

    @CommandLine.Option(names = "--batch", description = "Generate v0..v(N-1) under <out>/validators/", required = false)
    int batch;

    @Override public Integer call() throws Exception {
        if (batch < 0) {
            System.err.println("--batch must not be negative");
            return 2;
        }
        if (batch > 0) {
            for (int i = 0; i < batch; i++) {
                String vid = "v" + i;
                Path base = outDir.resolve("validators").resolve(vid);
                write(base);
                System.out.println("Wrote " + vid + " keys to " + base);
            }
            return 0;
        }

        write(outDir);
        System.out.println("Wrote keys for " + (id != null ? id : "(no-id)") + " to " + outDir);
        return 0;
    }

    private static void write(Path dir) throws Exception {
        KeyPair kp = KeyFiles.generateKeyPair();
        KeyFiles.writeKeyPair(dir.resolve(KeyFiles.PRIVATE_KEY_FILE), dir.resolve(KeyFiles.PUBLIC_KEY_FILE), kp);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new KeyGenMain()).execute(args));
    }
}
