package com.delta.factengine.facts.cli;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.fx.ExchangeRateRefreshService;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.ImportSummary;
import com.delta.factengine.facts.model.RunSummary;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import com.delta.factengine.facts.service.ActiveRunException;
import com.delta.factengine.facts.service.CompanyImportService;
import com.delta.factengine.facts.service.EngineSetupException;
import com.delta.factengine.facts.service.FinancialsRunCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FactEngineCliRunnerTest {

    @Mock
    private FinancialsJdbcRepository repository;

    @Mock
    private FinancialsRunCoordinator coordinator;

    @Mock
    private CompanyImportService importService;

    @Mock
    private ExchangeRateRefreshService refreshService;

    @Mock
    private SnapshotInspectionService inspectionService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private EngineProperties properties;
    private FactEngineCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        runner = new FactEngineCliRunner(
            properties, repository, coordinator, importService, refreshService, inspectionService, applicationContext
        );
        lenient().when(repository.isDbReachable()).thenReturn(true);
        lenient().when(repository.schemaPresent()).thenReturn(true);
    }

    @Test
    void runsSelectedRangeAndExitsZero() {
        List<CompanyTarget> targets = List.of(new CompanyTarget(1, "XOM", "Exxon Mobil"));
        when(repository.findCompanyTargets(0, 10)).thenReturn(targets);
        when(coordinator.runAll(targets, true)).thenReturn(summary("COMPLETED"));

        int code = runner.execute(new DefaultApplicationArguments("--force", "--offset=0", "--limit=10"));

        assertThat(code).isEqualTo(FactEngineCliRunner.EXIT_OK);
        verify(refreshService, never()).refresh();
    }

    @Test
    void unreachableDatabaseIsSetupFailure() {
        when(repository.isDbReachable()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        int code = runner.execute(new DefaultApplicationArguments());

        assertThat(code).isEqualTo(FactEngineCliRunner.EXIT_SETUP_FAILURE);
        verify(coordinator, never()).runAll(any(), anyBoolean());
    }

    @Test
    void missingSchemaIsSetupFailure() {
        when(repository.schemaPresent()).thenReturn(false);

        assertThat(runner.execute(new DefaultApplicationArguments())).isEqualTo(FactEngineCliRunner.EXIT_SETUP_FAILURE);
    }

    @Test
    void leaseConflictExitsTwo() {
        when(repository.findCompanyTargets(null, null)).thenReturn(List.of(new CompanyTarget(1, "XOM", "Exxon")));
        doThrow(new ActiveRunException("lock held")).when(coordinator).runAll(any(), anyBoolean());

        assertThat(runner.execute(new DefaultApplicationArguments())).isEqualTo(FactEngineCliRunner.EXIT_LEASE_CONFLICT);
    }

    @Test
    void badArgumentsAreSetupFailure() {
        assertThat(runner.execute(new DefaultApplicationArguments("--limit=zero")))
            .isEqualTo(FactEngineCliRunner.EXIT_SETUP_FAILURE);
        verify(repository, never()).isDbReachable();
    }

    @Test
    void unknownCompanyIdIsSetupFailure() {
        when(repository.findCompanyTarget(99L)).thenReturn(Optional.empty());

        assertThat(runner.execute(new DefaultApplicationArguments("--id=99")))
            .isEqualTo(FactEngineCliRunner.EXIT_SETUP_FAILURE);
    }

    @Test
    void singleCompanyRunUsesThatTarget() {
        CompanyTarget target = new CompanyTarget(7, "ABX", "Barrick Gold");
        when(repository.findCompanyTarget(7L)).thenReturn(Optional.of(target));
        when(coordinator.runAll(List.of(target), false)).thenReturn(summary("COMPLETED"));

        assertThat(runner.execute(new DefaultApplicationArguments("--id=7"))).isEqualTo(FactEngineCliRunner.EXIT_OK);
    }

    @Test
    void importExitsWithoutRunning() {
        when(importService.importCsv(Path.of("companies.csv"))).thenReturn(new ImportSummary(3, 0, List.of()));

        assertThat(runner.execute(new DefaultApplicationArguments("--import=companies.csv")))
            .isEqualTo(FactEngineCliRunner.EXIT_OK);
        verify(coordinator, never()).runAll(any(), anyBoolean());
    }

    @Test
    void unreadableImportIsSetupFailure() {
        when(importService.importCsv(any())).thenThrow(new EngineSetupException("cannot read"));

        assertThat(runner.execute(new DefaultApplicationArguments("--import=missing.csv")))
            .isEqualTo(FactEngineCliRunner.EXIT_SETUP_FAILURE);
    }

    @Test
    void inspectPrintsWithoutRunning() {
        when(inspectionService.inspectAsJson(null, 3)).thenReturn("[]");

        assertThat(runner.execute(new DefaultApplicationArguments("--inspect", "--limit=3")))
            .isEqualTo(FactEngineCliRunner.EXIT_OK);
        verify(coordinator, never()).runAll(any(), anyBoolean());
    }

    @Test
    void rateRefreshFailureDoesNotAbortRun() {
        when(refreshService.refresh()).thenThrow(new IllegalStateException("fx down"));
        when(repository.findCompanyTargets(null, null)).thenReturn(List.of());
        when(coordinator.runAll(List.of(), false)).thenReturn(summary("NO_TARGETS"));

        assertThat(runner.execute(new DefaultApplicationArguments("--refresh-rates")))
            .isEqualTo(FactEngineCliRunner.EXIT_OK);
    }

    @Test
    void disabledRunnerDoesNothing() throws Exception {
        properties.getCli().setRun(false);

        runner.run(new DefaultApplicationArguments("--force"));

        verify(repository, never()).isDbReachable();
    }

    private RunSummary summary(String status) {
        Instant now = Instant.now();
        return new RunSummary(now, now, status, 0, 0, 0, 0, 0, List.of());
    }
}
