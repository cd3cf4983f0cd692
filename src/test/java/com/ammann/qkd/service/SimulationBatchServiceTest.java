/* (C)2026 */
package com.ammann.qkd.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.qkd.enumeration.StatisticsStatus;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.exception.SomeThingWentWrongException;
import com.ammann.qkd.model.BatchRunSummary;
import com.ammann.qkd.model.BatchSummary;
import com.ammann.qkd.model.SimulationConfig;
import com.ammann.qkd.support.TestDataFactory;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SimulationBatchService")
class SimulationBatchServiceTest {

    private ExecutorService executor;
    private SimulationBatchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        service = new SimulationBatchService(TestDataFactory.simulationService(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("should run every seed and keep run order")
    void shouldRunEverySeedInOrder() {
        BatchSummary summary = service.runBatch(SimulationConfig.builder().build(), 4, 7L);

        assertThat(summary.runs()).isEqualTo(4);
        assertThat(summary.baseSeed()).isEqualTo(7L);
        assertThat(summary.results()).hasSize(4);
        for (int i = 0; i < 4; i++) {
            BatchRunSummary run = summary.results().get(i);
            assertThat(run.runIndex()).isEqualTo(i);
            assertThat(run.seed()).isEqualTo(RandomStreams.deriveSeed(7L, i));
            assertThat(run.peakOffset()).isEqualTo(5);
        }
        assertThat(summary.syncSuccessRate()).isEqualTo(1.0);
        assertThat(summary.meanAbsoluteOffsetError()).isZero();
        assertThat(summary.degenerateRuns()).isZero();
    }

    @Test
    @DisplayName("should reproduce a batch from its base seed")
    void shouldReproduceBatch() {
        SimulationConfig config = SimulationConfig.builder().blockSize(300).maxOffset(10).build();

        BatchSummary first = service.runBatch(config, 6, 99L);
        BatchSummary second = service.runBatch(config, 6, 99L);

        assertThat(second.results()).isEqualTo(first.results());
        assertThat(second.meanQber()).isEqualTo(first.meanQber());
    }

    @Test
    @DisplayName("should count degenerate runs and leave them out of the QBER")
    void shouldCountDegenerateRuns() {
        SimulationConfig dead = SimulationConfig.builder().lossProbability(1.0).darkCountRate(0.0).build();

        BatchSummary summary = service.runBatch(dead, 3, 1L);

        assertThat(summary.degenerateRuns()).isEqualTo(3);
        assertThat(summary.meanQber()).isZero();
        assertThat(summary.qberStd()).isZero();
        assertThat(summary.syncSuccessRate()).isZero();
        assertThat(summary.meanTotalCounts()).isZero();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 65})
    @DisplayName("should reject run counts outside the configured range")
    void shouldRejectRunCount(int runs) {
        assertThatThrownBy(() -> service.runBatch(SimulationConfig.builder().build(), runs, 1L))
                .isInstanceOfSatisfying(
                        InvalidParameterException.class,
                        e -> assertThat(e.getComponent()).isEqualTo(SimulationBatchService.COMPONENT));
    }

    @Test
    @DisplayName("should surface a rejected parameter unchanged")
    void shouldSurfaceRejectedParameter() {
        assertThatThrownBy(() -> service.runBatch(SimulationConfig.builder().blockSize(0).build(), 2, 1L))
                .isInstanceOfSatisfying(
                        InvalidParameterException.class,
                        e -> assertThat(e.getComponent()).isEqualTo(StateGeneratorService.COMPONENT));
    }

    @Test
    @DisplayName("should wrap unexpected failures")
    void shouldWrapUnexpectedFailures() {
        QuantumChannelSimulationService failing = mock(QuantumChannelSimulationService.class);
        when(failing.runSimulation(any())).thenThrow(new IllegalStateException("boom"));
        SimulationBatchService batch = new SimulationBatchService(failing, executor);

        assertThatThrownBy(() -> batch.runBatch(SimulationConfig.builder().build(), 2, 1L))
                .isInstanceOf(SomeThingWentWrongException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith(SimulationBatchService.COMPONENT);
    }

    @Test
    @DisplayName("should aggregate per-run outcomes")
    void shouldAggregateOutcomes() {
        List<BatchRunSummary> runs =
                List.of(
                        new BatchRunSummary(0, 11L, 5, true, 100, 0.10, StatisticsStatus.VALID),
                        new BatchRunSummary(1, 12L, 7, false, 80, 0.30, StatisticsStatus.VALID),
                        new BatchRunSummary(2, 13L, 0, false, 0, 0.0, StatisticsStatus.DEGENERATE),
                        new BatchRunSummary(3, 14L, 5, true, 120, 0.20, StatisticsStatus.VALID));

        BatchSummary summary = SimulationBatchService.aggregate(42L, 5, runs);

        assertThat(summary.runs()).isEqualTo(4);
        assertThat(summary.syncSuccessRate()).isEqualTo(0.5);
        assertThat(summary.meanQber()).isCloseTo(0.2, within(1e-12));
        assertThat(summary.qberStd()).isCloseTo(Math.sqrt(0.02 / 3), within(1e-12));
        assertThat(summary.meanTotalCounts()).isEqualTo(75.0);
        assertThat(summary.meanAbsoluteOffsetError()).isEqualTo(1.75);
        assertThat(summary.degenerateRuns()).isEqualTo(1);
    }
}
