package com.civicbiz.catalog.ingest.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class TargetBudgetTest {

    @Test
    void cappedBudgetStopsAtLimitAndReopensOnRelease() {
        TargetBudget budget = TargetBudget.capped(2);

        assertThat(budget.tryReserve()).isTrue();
        assertThat(budget.tryReserve()).isTrue();
        assertThat(budget.tryReserve()).isFalse();
        assertThat(budget.isExhausted()).isTrue();

        budget.release();
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.tryReserve()).isTrue();
        assertThat(budget.reserved()).isEqualTo(2);
    }

    @Test
    void unlimitedBudgetIsNeverExhausted() {
        TargetBudget budget = TargetBudget.unlimited();
        for (int i = 0; i < 1000; i++) {
            assertThat(budget.tryReserve()).isTrue();
        }
        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.limit()).isNull();
    }

    @Test
    void concurrentWorkersNeverOvershootTheCap() throws Exception {
        TargetBudget budget = TargetBudget.capped(100);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                futures.add(executor.submit(() -> {
                    int accepted = 0;
                    for (int i = 0; i < 50; i++) {
                        if (budget.tryReserve()) {
                            accepted++;
                        }
                    }
                    return accepted;
                }));
            }
            int total = 0;
            for (Future<Integer> future : futures) {
                total += future.get();
            }
            assertThat(total).isEqualTo(100);
            assertThat(budget.reserved()).isEqualTo(100);
        } finally {
            executor.shutdownNow();
        }
    }
}
