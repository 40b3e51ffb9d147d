package dbft.consensus.persistence;

import dbft.consensus.core.ConsensusState;
import dbft.consensus.validator.ValidatorSet;

/** A snapshot brought back to life: the roster it was rebuilt against and the state. */
public record LoadedEngine(ValidatorSet validators, ConsensusState state) {}
