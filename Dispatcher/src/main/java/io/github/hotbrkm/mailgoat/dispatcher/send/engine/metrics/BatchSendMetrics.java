package io.github.hotbrkm.mailgoat.dispatcher.send.engine.metrics;

import io.github.hotbrkm.mailgoat.dispatcher.domain.EmailAddressUtil;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.BatchStatus;
import io.github.hotbrkm.mailgoat.dispatcher.send.result.MessageOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records batch send metrics to a Micrometer registry.
 */
public class BatchSendMetrics {

    public static final String OUTCOME = "mailgoat.batch.outcome";
    public static final String SEND_DURATION = "mailgoat.batch.send.duration";
    public static final String RATE_LIMIT_WAIT = "mailgoat.batch.rate_limit.wait";
    public static final String SEALED = "mailgoat.batch.sealed";

    private final MeterRegistry registry;

    public BatchSendMetrics(MeterRegistry registry) {
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    /**
     * Counts one outcome, tagged with the domain of its first recipient.
     */
    public void recordOutcome(MessageOutcome outcome) {
        if (outcome == null) {
            return;
        }
        List<String> to = outcome.to();
        String domain = to.isEmpty() ? EmailAddressUtil.INVALID : EmailAddressUtil.extractDomain(to.get(0));
        registry.counter(OUTCOME,
                "status", outcome.status().code(),
                "domain", safe(domain),
                "kind", outcome.failureKind() == null ? "none" : outcome.failureKind().name())
                .increment();
    }

    public void recordSendDuration(long elapsedNanos, boolean success) {
        if (elapsedNanos < 0) {
            return;
        }
        registry.timer(SEND_DURATION, "result", success ? "success" : "failure")
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRateLimitWait(long waitNanos) {
        if (waitNanos <= 0) {
            return;
        }
        registry.timer(RATE_LIMIT_WAIT).record(waitNanos, TimeUnit.NANOSECONDS);
    }

    public void recordSealed(BatchStatus status) {
        registry.counter(SEALED, "status", status.code()).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private String safe(String value) {
        return value == null || value.isBlank() ? "none" : value;
    }
}
