package io.lightclient.core.client;

import java.util.Objects;

/** Outcome of an accepted update: the new client state and the consensus state it derived. */
public record UpdateResult(ClientState clientState, ConsensusState consensusState) {
    public UpdateResult {
        Objects.requireNonNull(clientState, "clientState");
        Objects.requireNonNull(consensusState, "consensusState");
    }
}
