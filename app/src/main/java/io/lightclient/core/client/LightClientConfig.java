package io.lightclient.core.client;

import io.lightclient.core.consensus.TrustLevel;
import io.lightclient.core.consensus.TrustVerifier;

import java.time.Duration;

/** Simple config holder for a light client. */
public final class LightClientConfig {
    public final TrustLevel trustLevel;
    public final Duration trustingPeriod;
    public final Duration unbondingPeriod;
    public final Duration maxClockDrift;
    public final long providerTimeoutMillis;
    public final int maxBisectionDepth;

    public LightClientConfig(TrustLevel trustLevel,
                             Duration trustingPeriod,
                             Duration unbondingPeriod,
                             Duration maxClockDrift,
                             long providerTimeoutMillis,
                             int maxBisectionDepth) {
        this.trustLevel = trustLevel;
        this.trustingPeriod = trustingPeriod;
        this.unbondingPeriod = unbondingPeriod;
        this.maxClockDrift = maxClockDrift;
        this.providerTimeoutMillis = providerTimeoutMillis;
        this.maxBisectionDepth = maxBisectionDepth;
    }

    public static LightClientConfig defaultLocal() {
        return new LightClientConfig(
                TrustLevel.DEFAULT,            // 1/3 of trusted power for skipping
                Duration.ofDays(14),           // trusting period
                Duration.ofDays(21),           // unbonding period of the counterparty
                Duration.ofSeconds(10),        // tolerated clock skew
                5_000L,                        // per-request provider timeout
                TrustVerifier.DEFAULT_MAX_BISECTION_DEPTH
        );
    }

    public LightClientConfig withTrustLevel(TrustLevel trustLevel) {
        return new LightClientConfig(trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift,
                providerTimeoutMillis, maxBisectionDepth);
    }

    public LightClientConfig withPeriods(Duration trustingPeriod, Duration unbondingPeriod) {
        return new LightClientConfig(trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift,
                providerTimeoutMillis, maxBisectionDepth);
    }

    public LightClientConfig withMaxClockDrift(Duration maxClockDrift) {
        return new LightClientConfig(trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift,
                providerTimeoutMillis, maxBisectionDepth);
    }

    public LightClientConfig withProviderTimeoutMillis(long providerTimeoutMillis) {
        return new LightClientConfig(trustLevel, trustingPeriod, unbondingPeriod, maxClockDrift,
                providerTimeoutMillis, maxBisectionDepth);
    }
}
