package dbft.common.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConsensusConfig {
    /** Network magic; also the snapshot key and the signing domain. */
    public long network;
    public long blockTimeMs = 15_000L;
    public long maxViewTimeoutMs = 240_000L;
    public String snapshotDir;
    public List<Validator> validators;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Validator {
        public int id;
        public String alias;
        @JsonAlias({"pubkeyPemPath", "publicKeyPath"})
        public String publicKeyPath;
    }

    public static ConsensusConfig load(Path path) throws IOException {
        ConsensusConfig cfg = new ObjectMapper().readValue(path.toFile(), ConsensusConfig.class);
        cfg.validate();
        return cfg;
    }

    public void validate() {
        if (network < 0 || network > 0xFFFFFFFFL) {
            throw new IllegalStateException("Config invalid: network must fit in 32 bits, got " + network);
        }
        if (blockTimeMs <= 0) {
            throw new IllegalStateException("Config invalid: blockTimeMs must be > 0");
        }
        if (maxViewTimeoutMs < blockTimeMs) {
            throw new IllegalStateException("Config invalid: maxViewTimeoutMs=" + maxViewTimeoutMs + " below blockTimeMs=" + blockTimeMs);
        }
        if (validators == null || validators.isEmpty()) {
            throw new IllegalStateException("Config invalid: validators list empty");
        }
        Set<Integer> seen = new HashSet<>();
        for (Validator v : validators) {
            if (v.id < 0 || v.id > 0xFFFF) {
                throw new IllegalStateException("Config invalid: validator id " + v.id + " outside 0..65535");
            }
            if (!seen.add(v.id)) {
                throw new IllegalStateException("Config invalid: duplicate validator id " + v.id);
            }
            if (v.publicKeyPath == null || v.publicKeyPath.isBlank()) {
                throw new IllegalStateException("Config invalid: validator " + v.id + " has no publicKeyPath");
            }
        }
    }
}
