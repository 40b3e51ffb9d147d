package dbft.consensus.validator;

import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;

public record Validator(ValidatorId id, PublicKey publicKey, String alias) {
    public Validator {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(publicKey, "publicKey");
    }

    public Validator(ValidatorId id, PublicKey publicKey) { this(id, publicKey, null); }

    public Optional<String> aliasOpt() { return Optional.ofNullable(alias); }
}
