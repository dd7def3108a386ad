package io.lightclient.core.provider;

import io.lightclient.core.protocol.LightBlock;

import java.util.Optional;

/**
 * Source of historical light blocks for bisection. Calls may block on the network and may
 * fail independently of one another.
 */
public interface HeaderProvider {

    /**
     * Light block at {@code height}, or empty if the source does not have it.
     *
     * @throws ProviderException if the source could not be reached or answered garbage
     */
    Optional<LightBlock> lightBlock(long height);

    /** Provider that never has anything; bisection with it never closes a trust-level gap. */
    static HeaderProvider none() {
        return height -> Optional.empty();
    }
}
