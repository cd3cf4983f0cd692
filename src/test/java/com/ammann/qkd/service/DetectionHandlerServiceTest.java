package com.ammann.qkd.service;

import com.ammann.qkd.enumeration.DetectionOrigin;
import com.ammann.qkd.exception.InvalidParameterException;
import com.ammann.qkd.model.DetectionEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ammann.qkd.support.TestDataFactory.event;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectionHandlerService}.
 */
class DetectionHandlerServiceTest
{
    private final DetectionHandlerService service = new DetectionHandlerService();

    private final List<DetectionEvent> survivors = List.of(
            event(40, DetectionOrigin.SIGNAL),
            event(3, DetectionOrigin.DECOY),
            event(17, DetectionOrigin.SIGNAL),
            event(3, DetectionOrigin.SIGNAL));

    @Test
    void zeroDarkRateKeepsOnlySurvivorsSorted()
    {
        List<DetectionEvent> record = service.recordDetections(survivors, 0.0, 50, RandomStreams.forSeed(1L));

        assertThat(record).hasSize(4);
        assertThat(record).extracting(DetectionEvent::timestampBin).containsExactly(3L, 3L, 17L, 40L);
        // same-bin events keep their input order
        assertThat(record.get(0).origin()).isEqualTo(DetectionOrigin.DECOY);
        assertThat(record.get(1).origin()).isEqualTo(DetectionOrigin.SIGNAL);
    }

    @Test
    void recordContainsSurvivorsPlusDarkCountsInTimeOrder()
    {
        List<DetectionEvent> record = service.recordDetections(survivors, 0.05, 200, RandomStreams.forSeed(2L));

        long dark = record.stream().filter(e -> e.origin() == DetectionOrigin.DARK).count();
        assertThat(record).hasSize(survivors.size() + (int) dark);
        assertThat(record).isSortedAccordingTo(DetectionEvent.BY_TIME);
        assertThat(record).containsAll(survivors);
    }

    @Test
    void darkCountsFollowConfiguredRateInsideWindow()
    {
        List<DetectionEvent> dark = service.generateDarkCounts(0.5, 10_000, RandomStreams.forSeed(3L));

        // Poisson total with mean 5000 and standard deviation ~71
        assertThat(dark.size()).isBetween(4700, 5300);
        assertThat(dark).allSatisfy(e -> {
            assertThat(e.origin()).isEqualTo(DetectionOrigin.DARK);
            assertThat(e.timestampBin()).isBetween(0L, 9_999L);
        });
    }

    @Test
    void highRateProducesSeveralEventsPerBin()
    {
        List<DetectionEvent> dark = service.generateDarkCounts(3.0, 100, RandomStreams.forSeed(4L));

        long distinctBins = dark.stream().mapToLong(DetectionEvent::timestampBin).distinct().count();
        assertThat((long) dark.size()).isGreaterThan(distinctBins);
    }

    @Test
    void survivorsAfterWindowAreNotObserved()
    {
        List<DetectionEvent> late = List.of(
                event(49, DetectionOrigin.SIGNAL),
                event(50, DetectionOrigin.SIGNAL),
                event(1_500_000_000L, DetectionOrigin.DECOY));

        List<DetectionEvent> record = service.recordDetections(late, 0.0, 50, RandomStreams.forSeed(9L));

        assertThat(record).extracting(DetectionEvent::timestampBin).containsExactly(49L);
    }

    @Test
    void recordIsUnmodifiable()
    {
        List<DetectionEvent> record = service.recordDetections(survivors, 0.0, 50, RandomStreams.forSeed(5L));

        assertThatThrownBy(() -> record.add(DetectionEvent.dark(1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void sameSeedGivesSameRecord()
    {
        List<DetectionEvent> first = service.recordDetections(survivors, 0.1, 500, RandomStreams.forSeed(6L));
        List<DetectionEvent> second = service.recordDetections(survivors, 0.1, 500, RandomStreams.forSeed(6L));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void rejectsNegativeDarkRate()
    {
        assertThatThrownBy(() -> service.recordDetections(survivors, -0.01, 50, RandomStreams.forSeed(7L)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("darkCountRate")
                .hasMessageStartingWith(DetectionHandlerService.COMPONENT);
    }

    @Test
    void rejectsEmptyWindow()
    {
        assertThatThrownBy(() -> service.recordDetections(survivors, 0.01, 0, RandomStreams.forSeed(8L)))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("detectionWindowBins");
    }
}
