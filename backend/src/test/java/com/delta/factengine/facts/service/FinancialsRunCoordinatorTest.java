package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.fx.ExchangeRateService;
import com.delta.factengine.facts.fx.ExchangeRateTable;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.CompanyUpdateStatus;
import com.delta.factengine.facts.model.CompanyUpdateSummary;
import com.delta.factengine.facts.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinancialsRunCoordinatorTest {

    @Mock
    private RunLease lease;

    @Mock
    private CompanyFinancialsService companyService;

    @Mock
    private ExchangeRateService exchangeRateService;

    private FinancialsRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setProgressLogInterval(2);
        coordinator = new FinancialsRunCoordinator(properties, lease, companyService, exchangeRateService);
        lenient().when(exchangeRateService.loadTable())
            .thenReturn(ExchangeRateTable.fromEntries(List.of(), "USD", "USD"));
    }

    @Test
    void failingEntityDoesNotAffectOthers() {
        List<CompanyTarget> targets = targets(5);
        when(companyService.process(any(), any())).thenAnswer(invocation -> {
            CompanyTarget target = invocation.getArgument(0);
            if (target.companyId() == 3) {
                throw new IllegalStateException("boom");
            }
            return summary(target, CompanyUpdateStatus.INSERTED);
        });

        RunSummary summary = coordinator.runAll(targets, 3, false);

        assertThat(summary.status()).isEqualTo("COMPLETED_WITH_ERRORS");
        assertThat(summary.attempted()).isEqualTo(5);
        assertThat(summary.inserted()).isEqualTo(4);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.companies().get(2).status()).isEqualTo(CompanyUpdateStatus.FAILED);
        assertThat(summary.companies().get(2).detail()).contains("boom");
        verify(lease).acquire();
        verify(lease).release();
    }

    @Test
    void leaseConflictTouchesNoEntity() {
        doThrow(new ActiveRunException("held")).when(lease).acquire();

        assertThatThrownBy(() -> coordinator.runAll(targets(3), 3, false))
            .isInstanceOf(ActiveRunException.class);

        verify(companyService, never()).process(any(), any());
        verify(exchangeRateService, never()).loadTable();
        verify(lease, never()).release();
    }

    @Test
    void concurrencyLimitBoundsInFlightEntities() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(companyService.process(any(), any())).thenAnswer(invocation -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return summary(invocation.getArgument(0), CompanyUpdateStatus.UPDATED);
        });

        RunSummary summary = coordinator.runAll(targets(12), 2, true);

        assertThat(summary.status()).isEqualTo("COMPLETED");
        assertThat(summary.updated()).isEqualTo(12);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void secondRunWithSameInputsIsAllSkipped() {
        List<CompanyUpdateStatus> statuses = new ArrayList<>(List.of(CompanyUpdateStatus.INSERTED, CompanyUpdateStatus.SKIPPED_FRESH));
        AtomicInteger call = new AtomicInteger();
        when(companyService.process(any(), any())).thenAnswer(invocation ->
            summary(invocation.getArgument(0), statuses.get(call.getAndIncrement() < 2 ? 0 : 1)));

        RunSummary first = coordinator.runAll(targets(2), 1, false);
        RunSummary second = coordinator.runAll(targets(2), 1, false);

        assertThat(first.inserted()).isEqualTo(2);
        assertThat(second.skipped()).isEqualTo(2);
        assertThat(second.inserted() + second.updated()).isZero();
    }

    @Test
    void emptyTargetListReportsNoTargets() {
        RunSummary summary = coordinator.runAll(List.of(), 3, false);

        assertThat(summary.status()).isEqualTo("NO_TARGETS");
        verify(lease).release();
    }

    @Test
    void shutdownBeforeDispatchInterruptsRun() {
        coordinator.requestShutdown();

        RunSummary summary = coordinator.runAll(targets(4), 2, false);

        assertThat(summary.status()).isEqualTo("INTERRUPTED");
        assertThat(summary.attempted()).isZero();
        verify(companyService, never()).process(any(), any());
        verify(lease).release();
    }

    @Test
    void shutdownGraceExpiryKeepsLeaseUntilInFlightCompanyFinishes() throws Exception {
        EngineProperties properties = new EngineProperties();
        properties.setShutdownGraceSeconds(1);
        FinancialsRunCoordinator shortGrace =
            new FinancialsRunCoordinator(properties, lease, companyService, exchangeRateService);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        when(companyService.process(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            proceed.await(10, TimeUnit.SECONDS);
            return summary(invocation.getArgument(0), CompanyUpdateStatus.UPDATED);
        });

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<RunSummary> run = caller.submit(() -> shortGrace.runAll(targets(3), 1, false));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            shortGrace.requestShutdown();

            verify(lease, never()).release();
            proceed.countDown();
            RunSummary summary = run.get(10, TimeUnit.SECONDS);
            assertThat(summary.status()).isEqualTo("INTERRUPTED");
            assertThat(summary.companies()).hasSize(1);
            assertThat(summary.updated()).isEqualTo(1);
            verify(lease).release();
        } finally {
            caller.shutdownNow();
        }
    }

    private List<CompanyTarget> targets(int count) {
        List<CompanyTarget> targets = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            targets.add(new CompanyTarget(i, "T" + i, "Company " + i));
        }
        return targets;
    }

    private CompanyUpdateSummary summary(CompanyTarget target, CompanyUpdateStatus status) {
        return new CompanyUpdateSummary(target.companyId(), target.ticker(), status, null, Set.of(), Map.of());
    }
}
