package io.lightclient.core.protocol;

/**
 * Digest function shared by header hashing, validator-set hashing and Merkle roots.
 * Must be bit-compatible with the digest the counterparty chain's consensus uses.
 */
@FunctionalInterface
public interface Hasher {
    byte[] hash(byte[] in);
}
