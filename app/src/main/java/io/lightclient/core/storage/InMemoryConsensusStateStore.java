package io.lightclient.core.storage;

import io.lightclient.core.client.ConsensusState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Simple thread-safe in-memory store. */
public final class InMemoryConsensusStateStore implements ConsensusStateStore {
    private final TreeMap<Long, ConsensusState> byHeight = new TreeMap<>();

    @Override
    public synchronized void put(ConsensusState state) {
        if (state == null) throw new IllegalArgumentException("consensus state required");
        ConsensusState existing = byHeight.get(state.height());
        if (existing != null) {
            if (existing.equals(state)) return;
            throw new IllegalArgumentException("conflicting consensus state at height " + state.height());
        }
        byHeight.put(state.height(), state);
    }

    @Override
    public synchronized Optional<ConsensusState> get(long height) {
        return Optional.ofNullable(byHeight.get(height));
    }

    @Override
    public synchronized Optional<ConsensusState> latest() {
        Map.Entry<Long, ConsensusState> last = byHeight.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public synchronized List<Long> heights() {
        return new ArrayList<>(byHeight.keySet());
    }

    @Override
    public synchronized long size() {
        return byHeight.size();
    }
}
