package io.github.hotbrkm.mailgoat.dispatcher.send.engine;

import io.github.hotbrkm.mailgoat.dispatcher.send.entry.BatchConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SendRateLimiter pacing")
class SendRateLimiterTest {

    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    @Test
    @DisplayName("Unlimited limiter never waits")
    void unlimitedNeverWaits() throws Exception {
        SendRateLimiter limiter = SendRateLimiter.unlimited();

        for (int i = 0; i < 100; i++) {
            assertThat(limiter.acquire()).isZero();
        }
        assertThat(limiter.isUnlimited()).isTrue();
        assertThat(limiter.getRatePerSecond()).isNull();
        assertThat(SendRateLimiter.of(null)).isSameAs(limiter);
    }

    @Test
    @DisplayName("M instant attempts at R per second wait at least ceil(M/R) - 1 seconds in total")
    void cumulativeWaitLowerBound() throws Exception {
        // Given
        FakeClock clock = new FakeClock();
        SendRateLimiter limiter = SendRateLimiter.perSecond(2, clock::now, clock::sleep);
        int attempts = 7;

        // When
        for (int i = 0; i < attempts; i++) {
            limiter.acquire();
        }

        // Then
        long minimum = (long) (Math.ceil(attempts / 2.0) - 1) * SECOND;
        assertThat(limiter.getTotalWaitNanos()).isGreaterThanOrEqualTo(minimum);
        assertThat(limiter.getTotalWaitNanos()).isEqualTo(6 * SECOND / 2);
        assertThat(limiter.getPermits()).isEqualTo(attempts);
    }

    @Test
    @DisplayName("Attempt starts are spaced at least 1/R apart")
    void strictSpacing() throws Exception {
        FakeClock clock = new FakeClock();
        SendRateLimiter limiter = SendRateLimiter.perSecond(4, clock::now, clock::sleep);
        List<Long> starts = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
            starts.add(clock.now());
            clock.advance(SECOND / 100);
        }

        for (int i = 1; i < starts.size(); i++) {
            assertThat(starts.get(i) - starts.get(i - 1)).isGreaterThanOrEqualTo(SECOND / 4);
        }
    }

    @Test
    @DisplayName("Idle time is not banked into a burst")
    void noBurstAfterIdle() throws Exception {
        FakeClock clock = new FakeClock();
        SendRateLimiter limiter = SendRateLimiter.perSecond(1, clock::now, clock::sleep);

        limiter.acquire();
        clock.advance(10 * SECOND);
        assertThat(limiter.acquire()).isZero();
        assertThat(limiter.acquire()).isEqualTo(SECOND);
    }

    @Test
    @DisplayName("Decimal rates are accepted")
    void decimalRate() throws Exception {
        FakeClock clock = new FakeClock();
        SendRateLimiter limiter = SendRateLimiter.perSecond(1.5, clock::now, clock::sleep);

        limiter.acquire();
        long waited = limiter.acquire();

        assertThat(waited).isEqualTo(Math.round(SECOND / 1.5));
        assertThat(limiter.getRatePerSecond()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Rates below one or not finite are configuration errors")
    void rejectsInvalidRates() {
        assertThatThrownBy(() -> SendRateLimiter.perSecond(0.5)).isInstanceOf(BatchConfigurationException.class);
        assertThatThrownBy(() -> SendRateLimiter.perSecond(0)).isInstanceOf(BatchConfigurationException.class);
        assertThatThrownBy(() -> SendRateLimiter.perSecond(Double.NaN)).isInstanceOf(BatchConfigurationException.class);
        assertThatThrownBy(() -> SendRateLimiter.of(Double.POSITIVE_INFINITY)).isInstanceOf(BatchConfigurationException.class);
    }

    @Test
    @DisplayName("Interrupt during the wait propagates")
    void interruptPropagates() throws Exception {
        FakeClock clock = new FakeClock();
        SendRateLimiter limiter = SendRateLimiter.perSecond(1, clock::now, nanos -> {
            throw new InterruptedException("stop");
        });

        limiter.acquire();
        assertThatThrownBy(limiter::acquire).isInstanceOf(InterruptedException.class);
    }

    static final class FakeClock {
        private long now = 1_000L;

        long now() {
            return now;
        }

        void sleep(long nanos) {
            now += nanos;
        }

        void advance(long nanos) {
            now += nanos;
        }
    }
}
