package dbft.common.config;

import dbft.common.crypto.KeyFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Public keys of the configured validators, keyed by validator id. */
public class KeyStore {

    private final Map<Integer, PublicKey> validators = new LinkedHashMap<>();

    public static KeyStore from(ConsensusConfig config, Path baseDir) throws IOException, GeneralSecurityException {
        KeyStore keyStore = new KeyStore();
        if (config.validators != null) {
            for (ConsensusConfig.Validator v : config.validators) {
                if (v.publicKeyPath != null && !v.publicKeyPath.isBlank()) {
                    keyStore.validators.put(v.id, KeyFiles.loadPublicKeyPem(baseDir.resolve(v.publicKeyPath)));
                }
            }
        }
        return keyStore;
    }

    public Optional<PublicKey> validatorKey(int id) { return Optional.ofNullable(validators.get(id)); }

    public int validatorCount() { return validators.size(); }
}
