package dev.buyergroup.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CreditLedgerTest {

    @Test
    @DisplayName("Should charge until the budget is reached and refuse afterwards")
    void shouldRefuseChargesPastBudget() {
        CreditLedger ledger = new CreditLedger();

        assertThat(ledger.tryChargeCollect(2, 5)).isTrue();
        assertThat(ledger.tryChargeCollect(2, 5)).isTrue();
        assertThat(ledger.tryChargeCollect(2, 5)).isFalse();

        assertThat(ledger.getCollectCredits()).isEqualTo(4);
        assertThat(ledger.getCollectCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep search and collect counters apart")
    void shouldTrackSearchAndCollectSeparately() {
        CreditLedger ledger = new CreditLedger();

        ledger.tryChargeSearch(1, 10);
        ledger.tryChargeSearch(1, 10);
        ledger.tryChargeCollect(2, 10);

        assertThat(ledger.getSearchCredits()).isEqualTo(2);
        assertThat(ledger.getCollectCredits()).isEqualTo(2);
        assertThat(ledger.getTotalCredits()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should price the snapshot in USD")
    void shouldPriceSnapshot() {
        CreditLedger ledger = new CreditLedger();
        ledger.tryChargeSearch(3, 10);
        ledger.tryChargeCollect(7, 10);

        CreditLedger.CreditsUsed used = ledger.snapshot(0.196);

        assertThat(used.search()).isEqualTo(3);
        assertThat(used.collect()).isEqualTo(7);
        assertThat(used.total()).isEqualTo(10);
        assertThat(used.estimatedCostUsd()).isCloseTo(1.96, within(1e-9));
    }

    @Test
    void shouldRejectNegativeCost() {
        CreditLedger ledger = new CreditLedger();

        assertThatThrownBy(() -> ledger.tryChargeSearch(-1, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Concurrent workers should never push the counter past the budget")
    void shouldNeverOverspendUnderContention() throws Exception {
        CreditLedger ledger = new CreditLedger();
        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < 100; j++) {
                        if (ledger.tryChargeCollect(2, 101)) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(ledger.getCollectCredits()).isEqualTo(100);
        assertThat(granted.get()).isEqualTo(50);
        assertThat(ledger.getCollectCalls()).isEqualTo(50);
    }
}
