package io.lightclient.core.client;

import io.lightclient.core.consensus.TrustLevel;
import io.lightclient.core.protocol.Header;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Trust anchor of a light client for one counterparty chain. Immutable: a verified update
 * or a freeze produces a new instance.
 *
 * The trusting period is expected to be shorter than the unbonding period; that is
 * assumed by the security argument and not checked here.
 */
public final class ClientState {
    private final String chainId;
    private final TrustLevel trustLevel;
    private final Duration trustingPeriod;
    private final Duration unbondingPeriod;
    private final Duration maxClockDrift;
    private final Header latestHeader;
    private final boolean frozen;

    public ClientState(String chainId,
                       TrustLevel trustLevel,
                       Duration trustingPeriod,
                       Duration unbondingPeriod,
                       Duration maxClockDrift,
                       Header latestHeader,
                       boolean frozen) {
        this.chainId = chainId;
        this.trustLevel = trustLevel;
        this.trustingPeriod = trustingPeriod;
        this.unbondingPeriod = unbondingPeriod;
        this.maxClockDrift = maxClockDrift;
        this.latestHeader = latestHeader;
        this.frozen = frozen;
        basicValidate();
    }

    /** New active client trusting {@code header}, with periods taken from {@code config}. */
    public static ClientState initial(String chainId, Header header, LightClientConfig config) {
        return new ClientState(chainId, config.trustLevel, config.trustingPeriod, config.unbondingPeriod,
                config.maxClockDrift, header, false);
    }

    public String chainId() { return chainId; }
    public TrustLevel trustLevel() { return trustLevel; }
    public Duration trustingPeriod() { return trustingPeriod; }
    public Duration unbondingPeriod() { return unbondingPeriod; }
    public Duration maxClockDrift() { return maxClockDrift; }
    public Header latestHeader() { return latestHeader; }
    public boolean frozen() { return frozen; }

    public long latestHeight() { return latestHeader.height(); }
    public Instant latestTimestamp() { return latestHeader.time(); }

    public ClientState withLatestHeader(Header header) {
        return new ClientState(chainId, trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift, header, frozen);
    }

    public ClientState freeze() {
        return new ClientState(chainId, trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift, latestHeader, true);
    }

    public void basicValidate() {
        if (chainId == null || chainId.isBlank()) throw new IllegalArgumentException("chainId required");
        if (trustLevel == null) throw new IllegalArgumentException("trust level required");
        requirePositive("trusting period", trustingPeriod);
        requirePositive("unbonding period", unbondingPeriod);
        if (maxClockDrift == null || maxClockDrift.isNegative()) {
            throw new IllegalArgumentException("max clock drift must be >= 0");
        }
        if (latestHeader == null) throw new IllegalArgumentException("latest header required");
        if (!chainId.equals(latestHeader.chainId())) {
            throw new IllegalArgumentException("latest header is for chain " + latestHeader.chainId()
                    + ", client tracks " + chainId);
        }
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be > 0");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientState)) return false;
        ClientState other = (ClientState) o;
        return frozen == other.frozen
                && chainId.equals(other.chainId)
                && trustLevel.equals(other.trustLevel)
                && trustingPeriod.equals(other.trustingPeriod)
                && unbondingPeriod.equals(other.unbondingPeriod)
                && maxClockDrift.equals(other.maxClockDrift)
                && latestHeader.equals(other.latestHeader);
    }

    @Override public int hashCode() { return Objects.hash(chainId, latestHeader, frozen); }

    @Override public String toString() {
        return "ClientState{chain=" + chainId + ", h=" + latestHeight() + ", frozen=" + frozen + "}";
    }
}
