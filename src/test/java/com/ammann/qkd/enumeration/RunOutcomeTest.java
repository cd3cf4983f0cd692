/* (C)2026 */
package com.ammann.qkd.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.qkd.model.SimulationStatistics;
import org.junit.jupiter.api.Test;

class RunOutcomeTest {

    @Test
    void classifiesStatistics() {
        SimulationStatistics synced =
                new SimulationStatistics(10, 0.1, 0.05, true, 8, 1, 1, 1, 0.08, 0.01, StatisticsStatus.VALID);
        SimulationStatistics unsynced =
                new SimulationStatistics(10, 0.1, 0.5, false, 5, 4, 1, 5, 0.05, 0.04, StatisticsStatus.VALID);

        assertThat(RunOutcome.of(synced)).isEqualTo(RunOutcome.SYNCED);
        assertThat(RunOutcome.of(unsynced)).isEqualTo(RunOutcome.UNSYNCED);
        assertThat(RunOutcome.of(SimulationStatistics.degenerate(false))).isEqualTo(RunOutcome.DEGENERATE);
    }

    @Test
    void tagsAreLowerCaseNames() {
        for (RunOutcome outcome : RunOutcome.values()) {
            assertThat(outcome.getTag()).isEqualTo(outcome.name().toLowerCase());
        }
    }

    @Test
    void originDistinguishesTransmittedFromDark() {
        assertThat(DetectionOrigin.forPulse(true)).isEqualTo(DetectionOrigin.SIGNAL);
        assertThat(DetectionOrigin.forPulse(false)).isEqualTo(DetectionOrigin.DECOY);
        assertThat(DetectionOrigin.SIGNAL.isTransmitted()).isTrue();
        assertThat(DetectionOrigin.DECOY.isTransmitted()).isTrue();
        assertThat(DetectionOrigin.DARK.isTransmitted()).isFalse();
    }
}
