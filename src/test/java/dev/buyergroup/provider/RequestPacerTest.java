package dev.buyergroup.provider;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class RequestPacerTest {

    @Test
    void shouldSpaceReservationsByInterval() {
        RequestPacer pacer = new RequestPacer(4.0);
        long now = 1_000_000_000L;

        assertThat(pacer.getIntervalNanos()).isEqualTo(250_000_000L);
        assertThat(pacer.reserve(now)).isEqualTo(now);
        assertThat(pacer.reserve(now)).isEqualTo(now + 250_000_000L);
        assertThat(pacer.reserve(now)).isEqualTo(now + 500_000_000L);
    }

    @Test
    void shouldNotQueueBehindIdlePeriods() {
        RequestPacer pacer = new RequestPacer(4.0);
        long now = 1_000_000_000L;
        pacer.reserve(now);

        long later = now + 5_000_000_000L;

        assertThat(pacer.reserve(later)).isEqualTo(later);
    }

    @Test
    void shouldNotPaceWhenRateIsUnlimited() {
        RequestPacer pacer = new RequestPacer(0);

        assertThat(pacer.getIntervalNanos()).isZero();
        StepVerifier.create(pacer.acquire()).verifyComplete();
    }

    @Test
    void shouldReleaseCallersInTurn() {
        RequestPacer pacer = new RequestPacer(100.0);

        StepVerifier.create(pacer.acquire().then(pacer.acquire()).then(pacer.acquire()))
                .verifyComplete();
    }
}
