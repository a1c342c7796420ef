package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.fx.ExchangeRateService;
import com.delta.factengine.facts.fx.ExchangeRateTable;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.CompanyUpdateStatus;
import com.delta.factengine.facts.model.CompanyUpdateSummary;
import com.delta.factengine.facts.model.RunSummary;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class FinancialsRunCoordinator {
    private static final Logger log = LoggerFactory.getLogger(FinancialsRunCoordinator.class);

    private final EngineProperties properties;
    private final RunLease lease;
    private final CompanyFinancialsService companyService;
    private final ExchangeRateService exchangeRateService;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicReference<CountDownLatch> activeRun = new AtomicReference<>();

    public FinancialsRunCoordinator(
        EngineProperties properties,
        RunLease lease,
        CompanyFinancialsService companyService,
        ExchangeRateService exchangeRateService
    ) {
        this.properties = properties;
        this.lease = lease;
        this.companyService = companyService;
        this.exchangeRateService = exchangeRateService;
    }

    public RunSummary runAll(List<CompanyTarget> entities, boolean force) {
        return runAll(entities, properties.getGlobalConcurrency(), force);
    }

    public RunSummary runAll(List<CompanyTarget> entities, int concurrencyLimit, boolean force) {
        List<CompanyTarget> targets = entities == null ? List.of() : List.copyOf(entities);
        Instant startedAt = Instant.now();
        lease.acquire();

        CountDownLatch finished = new CountDownLatch(1);
        activeRun.set(finished);
        ExecutorService pool = null;
        try {
            if (targets.isEmpty()) {
                log.info("No companies to update");
                return new RunSummary(startedAt, Instant.now(), "NO_TARGETS", 0, 0, 0, 0, 0, List.of());
            }

            ExchangeRateTable rates = exchangeRateService.loadTable();
            RunContext context = new RunContext(startedAt, force, rates, shutdownRequested);
            int limit = Math.max(1, Math.min(EngineProperties.MAX_CONCURRENCY, concurrencyLimit));
            log.info("Starting financials run for {} companies (concurrency={}, force={})", targets.size(), limit, force);

            pool = newWorkerPool(limit);
            Semaphore permits = new Semaphore(limit);
            CompanyUpdateSummary[] results = new CompanyUpdateSummary[targets.size()];
            AtomicInteger completed = new AtomicInteger();
            int progressInterval = properties.getProgressLogInterval();
            int dispatched = 0;

            for (int i = 0; i < targets.size(); i++) {
                if (shutdownRequested.get()) {
                    break;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    shutdownRequested.set(true);
                    break;
                }
                if (shutdownRequested.get()) {
                    permits.release();
                    break;
                }
                int index = i;
                CompanyTarget target = targets.get(i);
                try {
                    pool.submit(() -> {
                        try {
                            results[index] = processSafely(target, context);
                            int done = completed.incrementAndGet();
                            if (done % progressInterval == 0) {
                                log.info("Progress: {}/{} companies processed", done, targets.size());
                            }
                        } finally {
                            permits.release();
                        }
                    });
                    dispatched++;
                } catch (RejectedExecutionException e) {
                    permits.release();
                    log.warn("Worker pool rejected {}; stopping dispatch", target.ticker());
                    break;
                }
            }

            if (dispatched < targets.size()) {
                log.warn("Shutdown requested; {} companies were not dispatched", targets.size() - dispatched);
            }
            pool.shutdown();
            awaitInFlight(pool);
            return summarize(startedAt, targets, results, dispatched);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
            lease.release();
            activeRun.set(null);
            finished.countDown();
        }
    }

    /**
     * Stops dispatching new companies and waits up to the shutdown grace period for in-flight
     * companies to finish. Invoked on context close, which the JVM signal hooks trigger.
     * <p>
     * The lease is only ever released by {@link #runAll}; if the process dies before that, the
     * marker goes stale and the next run reclaims it.
     */
    @PreDestroy
    public void requestShutdown() {
        shutdownRequested.set(true);
        CountDownLatch running = activeRun.get();
        if (running == null) {
            return;
        }
        int graceSeconds = properties.getShutdownGraceSeconds();
        log.warn("Shutdown requested; waiting up to {}s for in-flight companies", graceSeconds);
        try {
            if (!running.await(graceSeconds, TimeUnit.SECONDS)) {
                log.warn("In-flight companies did not finish within {}s; lease stays held until they do", graceSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight companies; lease stays held");
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    private CompanyUpdateSummary processSafely(CompanyTarget target, RunContext context) {
        try {
            return companyService.process(target, context);
        } catch (RuntimeException e) {
            log.error("Company {} (id {}) failed", target.ticker(), target.companyId(), e);
            return CompanyUpdateSummary.failed(target, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void awaitInFlight(ExecutorService pool) {
        try {
            while (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.debug("Waiting for in-flight companies");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownRequested.set(true);
            log.warn("Interrupted while waiting for in-flight companies");
        }
    }

    private RunSummary summarize(Instant startedAt, List<CompanyTarget> targets, CompanyUpdateSummary[] results, int dispatched) {
        List<CompanyUpdateSummary> companies = new ArrayList<>();
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        for (int i = 0; i < dispatched; i++) {
            CompanyUpdateSummary summary = results[i];
            if (summary == null) {
                summary = CompanyUpdateSummary.failed(targets.get(i), "did not complete");
            }
            companies.add(summary);
            CompanyUpdateStatus status = summary.status();
            if (status == CompanyUpdateStatus.INSERTED) {
                inserted++;
            } else if (status == CompanyUpdateStatus.UPDATED) {
                updated++;
            } else if (status.isSkipped()) {
                skipped++;
            } else {
                failed++;
            }
        }
        String status;
        if (dispatched < targets.size()) {
            status = "INTERRUPTED";
        } else if (failed > 0) {
            status = "COMPLETED_WITH_ERRORS";
        } else {
            status = "COMPLETED";
        }
        Instant finishedAt = Instant.now();
        log.info(
            "Financials run {}: attempted={}, inserted={}, updated={}, skipped={}, failed={}",
            status, companies.size(), inserted, updated, skipped, failed
        );
        return new RunSummary(startedAt, finishedAt, status, companies.size(), inserted, updated, skipped, failed, companies);
    }

    private ExecutorService newWorkerPool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("financials-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
