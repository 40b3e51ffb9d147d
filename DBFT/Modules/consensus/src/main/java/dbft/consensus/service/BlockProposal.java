package dbft.consensus.service;

import dbft.consensus.message.Hash256;

import java.util.List;
import java.util.Objects;

public record BlockProposal(Hash256 hash, List<Hash256> txHashes) {
    public BlockProposal {
        Objects.requireNonNull(hash, "hash");
        txHashes = List.copyOf(txHashes);
    }
}
