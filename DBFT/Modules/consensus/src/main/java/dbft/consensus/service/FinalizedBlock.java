package dbft.consensus.service;

import com.google.protobuf.ByteString;
import dbft.consensus.message.Hash256;
import dbft.consensus.message.ViewNumber;
import dbft.consensus.validator.ValidatorId;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** A proposal a quorum committed to, with the block signatures carried by those commits. */
public record FinalizedBlock(long height, ViewNumber view, Hash256 proposal, Map<ValidatorId, ByteString> commitSignatures) {
    public FinalizedBlock {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(proposal, "proposal");
        commitSignatures = Collections.unmodifiableMap(new TreeMap<>(commitSignatures));
    }
}
