package io.lightclient.core.provider;

import io.lightclient.core.protocol.LightBlock;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Light blocks held in memory, keyed by height. Backs the header server and tests.
 */
public final class InMemoryHeaderProvider implements HeaderProvider {

    private final Map<Long, LightBlock> blocks = new TreeMap<>();

    public InMemoryHeaderProvider() {}

    public InMemoryHeaderProvider(Collection<LightBlock> initial) {
        if (initial != null) {
            for (LightBlock block : initial) {
                put(block);
            }
        }
    }

    /** Store a light block, replacing any block previously stored at its height. */
    public synchronized void put(LightBlock block) {
        if (block == null) return;
        blocks.put(block.height(), block);
    }

    @Override
    public synchronized Optional<LightBlock> lightBlock(long height) {
        return Optional.ofNullable(blocks.get(height));
    }

    public synchronized int size() {
        return blocks.size();
    }
}
