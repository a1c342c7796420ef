package com.delta.factengine.facts.cli;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.fx.ExchangeRateRefreshService;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.CompanyUpdateStatus;
import com.delta.factengine.facts.model.CompanyUpdateSummary;
import com.delta.factengine.facts.model.ImportSummary;
import com.delta.factengine.facts.model.RunSummary;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import com.delta.factengine.facts.service.ActiveRunException;
import com.delta.factengine.facts.service.CompanyImportService;
import com.delta.factengine.facts.service.EngineSetupException;
import com.delta.factengine.facts.service.FinancialsRunCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
public class FactEngineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FactEngineCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_LEASE_CONFLICT = 2;
    static final int EXIT_SETUP_FAILURE = 3;

    private final EngineProperties properties;
    private final FinancialsJdbcRepository repository;
    private final FinancialsRunCoordinator coordinator;
    private final CompanyImportService importService;
    private final ExchangeRateRefreshService refreshService;
    private final SnapshotInspectionService inspectionService;
    private final ConfigurableApplicationContext applicationContext;

    public FactEngineCliRunner(
        EngineProperties properties,
        FinancialsJdbcRepository repository,
        FinancialsRunCoordinator coordinator,
        CompanyImportService importService,
        ExchangeRateRefreshService refreshService,
        SnapshotInspectionService inspectionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.repository = repository;
        this.coordinator = coordinator;
        this.importService = importService;
        this.refreshService = refreshService;
        this.inspectionService = inspectionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        int exitCode = execute(args);
        if (properties.getCli().isExitAfterRun() && !coordinator.isShutdownRequested()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(ApplicationArguments args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_SETUP_FAILURE;
        }

        if (!databaseReady()) {
            return EXIT_SETUP_FAILURE;
        }

        try {
            if (options.hasImport()) {
                ImportSummary summary = importService.importCsv(Path.of(options.importPath()));
                log.info("Import finished: upserted={}, skipped={}", summary.companiesUpserted(), summary.rowsSkipped());
                return EXIT_OK;
            }

            if (options.inspect()) {
                System.out.println(inspectionService.inspectAsJson(options.companyId(), options.limit()));
                return EXIT_OK;
            }

            if (options.refreshRates() || properties.getFx().isRefreshOnStart()) {
                refreshRates();
            }

            List<CompanyTarget> targets;
            if (options.companyId() != null) {
                Optional<CompanyTarget> target = repository.findCompanyTarget(options.companyId());
                if (target.isEmpty()) {
                    log.error("No company with id {}", options.companyId());
                    return EXIT_SETUP_FAILURE;
                }
                targets = List.of(target.get());
            } else {
                targets = repository.findCompanyTargets(options.offset(), options.limit());
            }

            RunSummary summary = coordinator.runAll(targets, options.force());
            logSummary(summary);
            return EXIT_OK;
        } catch (ActiveRunException e) {
            log.error("Another run is active: {}", e.getMessage());
            return EXIT_LEASE_CONFLICT;
        } catch (EngineSetupException e) {
            log.error("Setup failure: {}", e.getMessage(), e);
            return EXIT_SETUP_FAILURE;
        }
    }

    private boolean databaseReady() {
        boolean reachable;
        try {
            reachable = repository.isDbReachable();
        } catch (Exception e) {
            log.error("Database unreachable: {}", e.getMessage());
            return false;
        }
        if (!reachable) {
            log.error("Database unreachable");
            return false;
        }
        if (!repository.schemaPresent()) {
            log.error("Database schema is missing; run the migrations first");
            return false;
        }
        return true;
    }

    private void refreshRates() {
        try {
            refreshService.refresh();
        } catch (RuntimeException e) {
            log.warn("Exchange rate refresh failed; continuing with stored rates", e);
        }
    }

    private void logSummary(RunSummary summary) {
        log.info(
            "Run {} finished: attempted={}, inserted={}, updated={}, skipped={}, failed={}",
            summary.status(),
            summary.attempted(),
            summary.inserted(),
            summary.updated(),
            summary.skipped(),
            summary.failed()
        );
        for (CompanyUpdateSummary company : summary.companies()) {
            if (company.status() == CompanyUpdateStatus.FAILED || !company.fetchFailures().isEmpty()) {
                log.info(
                    "Summary {}: status={}, detail={}, fetchFailures={}",
                    company.ticker(),
                    company.status(),
                    company.detail(),
                    company.fetchFailures()
                );
            }
        }
    }
}
