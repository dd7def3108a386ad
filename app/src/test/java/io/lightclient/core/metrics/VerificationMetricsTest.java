package io.lightclient.core.metrics;

import io.lightclient.core.consensus.ErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerificationMetricsTest {

    @Test
    void countsOutcomesByCode() {
        VerificationMetrics metrics = new VerificationMetrics(new SimpleMeterRegistry());

        metrics.updateAccepted();
        metrics.updateRejected(ErrorCode.NON_MONOTONIC_HEIGHT);
        metrics.updateRejected(ErrorCode.NON_MONOTONIC_HEIGHT);
        metrics.providerFetch(true);
        metrics.providerFetch(false);
        metrics.bisectionStep();

        assertEquals(1.0, metrics.count("accepted", "none"));
        assertEquals(2.0, metrics.count("rejected", "NON_MONOTONIC_HEIGHT"));
        assertEquals(2.0, metrics.providerFetches());
        assertEquals(1.0, metrics.bisectionSteps());
    }

    @Test
    void recordsUpdateTimeAndScrapes() {
        VerificationMetrics metrics = new VerificationMetrics();

        assertEquals("done", metrics.recordUpdate(() -> "done"));
        String scrape = metrics.scrape();

        assertTrue(scrape.contains(VerificationMetrics.UPDATE_TIME));
        assertTrue(scrape.contains(VerificationMetrics.PROVIDER_FETCHES));
        assertTrue(scrape.contains("result=failed"));
        assertEquals(1L, metrics.registry().get(VerificationMetrics.UPDATE_TIME).timer().count());
    }
}
