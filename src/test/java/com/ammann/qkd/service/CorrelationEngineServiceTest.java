package com.ammann.qkd.service;

import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.CorrelationResult;
import com.ammann.qkd.model.Histogram;
import com.ammann.qkd.support.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CorrelationEngineService}.
 *
 * <p>Shift recovery uses a sparse Golomb-ruler pattern: any shift other than the true one overlaps
 * the pattern in at most one bin, so the true shift stands far above the floor.
 */
class CorrelationEngineServiceTest
{
    private static final int REFERENCE_LENGTH = 100;
    private static final int MAX_OFFSET = 20;

    private final CorrelationEngineService service = new CorrelationEngineService();

    @ParameterizedTest
    @ValueSource(ints = {-17, -7, 0, 3, 12, 20})
    void recoversKnownShift(int shift)
    {
        int[] pattern = TestDataFactory.golombPattern(REFERENCE_LENGTH, 30);
        Histogram reference = Histogram.of(pattern);
        Histogram detected = TestDataFactory.shifted(pattern, shift, REFERENCE_LENGTH + MAX_OFFSET);

        CorrelationResult result = service.correlate(reference, detected, MAX_OFFSET);

        assertThat(result.peakOffset()).isEqualTo(shift);
        assertThat(result.peakValue()).isEqualTo(TestDataFactory.GOLOMB_MARKS.length);
        assertThat(result.syncSuccess()).isTrue();
        assertThat(result.peakSignificance()).isGreaterThan(3.0);
    }

    @Test
    void reportsEveryOffsetInRange()
    {
        int[] pattern = TestDataFactory.golombPattern(REFERENCE_LENGTH, 30);

        CorrelationResult result = service.correlate(Histogram.of(pattern),
                TestDataFactory.shifted(pattern, 4, REFERENCE_LENGTH), MAX_OFFSET);

        assertThat(result.offsets()).hasSize(2 * MAX_OFFSET + 1);
        assertThat(result.offsets()[0]).isEqualTo(-MAX_OFFSET);
        assertThat(result.offsets()[2 * MAX_OFFSET]).isEqualTo(MAX_OFFSET);
        assertThat(result.correlationValues()).hasSize(2 * MAX_OFFSET + 1);
        assertThat(result.correlationValues()[MAX_OFFSET + 4]).isEqualTo(result.peakValue());
    }

    @Test
    void tiesResolveToSmallestMagnitudeThenNegative()
    {
        Histogram reference = Histogram.of(0, 0, 1, 0, 0);
        Histogram detected = Histogram.of(1, 0, 0, 0, 1);

        CorrelationResult result = service.correlate(reference, detected, 2);

        assertThat(result.correlationValues()).containsExactly(1.0, 0.0, 0.0, 0.0, 1.0);
        assertThat(result.peakOffset()).isEqualTo(-2);
        assertThat(result.syncSuccess()).isFalse();
    }

    @Test
    void peakSelectionPrefersSmallerMagnitude()
    {
        assertThat(CorrelationEngineService.isBetterPeak(1, 5.0, -3, 5.0)).isTrue();
        assertThat(CorrelationEngineService.isBetterPeak(-1, 5.0, 1, 5.0)).isTrue();
        assertThat(CorrelationEngineService.isBetterPeak(1, 5.0, -1, 5.0)).isFalse();
        assertThat(CorrelationEngineService.isBetterPeak(10, 6.0, 0, 5.0)).isTrue();
        assertThat(CorrelationEngineService.isBetterPeak(0, 4.0, 10, 5.0)).isFalse();
    }

    @Test
    void emptyDetectionNeverSynchronises()
    {
        int[] pattern = TestDataFactory.golombPattern(REFERENCE_LENGTH, 30);

        CorrelationResult result = service.correlate(Histogram.of(pattern),
                Histogram.zeros(REFERENCE_LENGTH + MAX_OFFSET), MAX_OFFSET);

        assertThat(result.correlationValues()).containsOnly(0.0);
        assertThat(result.peakOffset()).isZero();
        assertThat(result.syncSuccess()).isFalse();
        assertThat(result.noiseFloorStd()).isZero();
    }

    @Test
    void uniformOverlapDoesNotSynchronise()
    {
        int[] ones = new int[50];
        Arrays.fill(ones, 1);

        CorrelationResult result = service.correlate(Histogram.of(ones), Histogram.of(ones), 5);

        // C(k) = 50 - |k|: floor mean 47, std sqrt(2)
        assertThat(result.peakOffset()).isZero();
        assertThat(result.peakValue()).isEqualTo(50.0);
        assertThat(result.noiseFloorMean()).isCloseTo(47.0, within(1e-9));
        assertThat(result.noiseFloorStd()).isCloseTo(Math.sqrt(2.0), within(1e-9));
        assertThat(result.syncSuccess()).isFalse();
    }

    @Test
    void lowerThresholdAcceptsWeakerPeak()
    {
        int[] ones = new int[50];
        Arrays.fill(ones, 1);

        CorrelationResult result = service.correlate(Histogram.of(ones), Histogram.of(ones), 5, 2.0);

        assertThat(result.syncSuccess()).isTrue();
    }

    @Test
    void correlationSumsOverlappingBins()
    {
        int[] reference = {1, 2, 0};
        int[] detected = {0, 1, 1, 3};

        assertThat(CorrelationEngineService.correlationAt(reference, detected, 0)).isEqualTo(2.0);
        assertThat(CorrelationEngineService.correlationAt(reference, detected, 1)).isEqualTo(3.0);
        assertThat(CorrelationEngineService.correlationAt(reference, detected, 2)).isEqualTo(7.0);
        assertThat(CorrelationEngineService.correlationAt(reference, detected, -1)).isEqualTo(0.0);
    }

    @Test
    void parallelEvaluationMatchesSequential()
    {
        int[] pattern = TestDataFactory.golombPattern(REFERENCE_LENGTH, 30);
        Histogram reference = Histogram.of(pattern);
        Histogram detected = TestDataFactory.shifted(pattern, -9, REFERENCE_LENGTH + MAX_OFFSET);
        CorrelationEngineService parallel = new CorrelationEngineService();
        parallel.parallelThreshold = 0;

        CorrelationResult sequential = service.correlate(reference, detected, MAX_OFFSET);
        CorrelationResult concurrent = parallel.correlate(reference, detected, MAX_OFFSET);

        assertThat(concurrent.offsets()).containsExactly(sequential.offsets());
        assertThat(concurrent.correlationValues()).containsExactly(sequential.correlationValues());
        assertThat(concurrent.peakOffset()).isEqualTo(sequential.peakOffset());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 5, 6})
    void rejectsOffsetRangeOutsideHistograms(int maxOffset)
    {
        Histogram reference = Histogram.of(0, 0, 1, 0, 0);
        Histogram detected = Histogram.of(1, 0, 0, 0, 1, 0, 0);

        assertThatThrownBy(() -> service.correlate(reference, detected, maxOffset))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("maxOffset")
                .isInstanceOfSatisfying(InvalidParameterException.class,
                        e -> assertThat(e.getComponent()).isEqualTo(CorrelationEngineService.COMPONENT));
    }

    @Test
    void rejectsNegativeThreshold()
    {
        assertThatThrownBy(() -> service.correlate(Histogram.of(1, 0, 1), Histogram.of(1, 0, 1), 1, -0.5))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("confidenceThreshold");
    }

    @Test
    void rejectsEmptyHistograms()
    {
        assertThatThrownBy(() -> service.correlate(Histogram.zeros(0), Histogram.of(1, 2), 1))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("reference.length");
    }
}
