package io.lightclient.core.metrics;

import io.lightclient.core.consensus.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer instrumentation for client updates, bisection and provider traffic.
 * The registry is passed in; each light client owns its own instance.
 */
public final class VerificationMetrics {
    public static final String UPDATES = "lightclient.updates";
    public static final String UPDATE_TIME = "lightclient.update.time";
    public static final String PROVIDER_FETCHES = "lightclient.provider.fetches";
    public static final String BISECTION_STEPS = "lightclient.bisection.steps";

    private final MeterRegistry registry;
    private final Timer updateTime;
    private final Counter providerFetches;
    private final Counter providerFailures;
    private final Counter bisectionSteps;

    public VerificationMetrics() {
        this(new SimpleMeterRegistry());
    }

    public VerificationMetrics(MeterRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry required");
        this.registry = registry;
        this.updateTime = Timer.builder(UPDATE_TIME)
                .description("Time spent verifying and applying one client update")
                .register(registry);
        this.providerFetches = Counter.builder(PROVIDER_FETCHES)
                .description("Light blocks requested from the header provider")
                .tag("result", "ok")
                .register(registry);
        this.providerFailures = Counter.builder(PROVIDER_FETCHES)
                .description("Light blocks requested from the header provider")
                .tag("result", "failed")
                .register(registry);
        this.bisectionSteps = Counter.builder(BISECTION_STEPS)
                .description("Intermediate heights tried while bisecting")
                .register(registry);
    }

    public <T> T recordUpdate(Supplier<T> update) {
        return updateTime.record(update);
    }

    public void updateAccepted() {
        updateCounter("accepted", "none").increment();
    }

    public void updateRejected(ErrorCode code) {
        updateCounter("rejected", code.name()).increment();
    }

    public void providerFetch(boolean ok) {
        (ok ? providerFetches : providerFailures).increment();
    }

    public void bisectionStep() {
        bisectionSteps.increment();
    }

    public double count(String outcome, String code) {
        return updateCounter(outcome, code).count();
    }

    public double providerFetches() {
        return providerFetches.count() + providerFailures.count();
    }

    public double bisectionSteps() {
        return bisectionSteps.count();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String scrape() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    private Counter updateCounter(String outcome, String code) {
        return Counter.builder(UPDATES)
                .description("Client updates by outcome")
                .tag("outcome", outcome)
                .tag("code", code)
                .register(registry);
    }
}
