package io.lightclient.core.storage;

import io.lightclient.core.client.ConsensusState;

import java.util.List;
import java.util.Optional;

/**
 * Verified consensus states keyed by height. A height, once written, never changes:
 * writing an equal state again is a no-op, writing a different one is rejected.
 */
public interface ConsensusStateStore {

    /** @throws IllegalArgumentException if a different state is already stored at that height */
    void put(ConsensusState state);

    Optional<ConsensusState> get(long height);

    /** Highest stored height, if any. */
    Optional<ConsensusState> latest();

    /** Stored heights, ascending. */
    List<Long> heights();

    long size();
}
