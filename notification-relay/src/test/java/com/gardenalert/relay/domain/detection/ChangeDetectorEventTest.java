package com.gardenalert.relay.domain.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gardenalert.relay.domain.catalog.EventState;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class ChangeDetectorEventTest extends ChangeDetectorBaseTest {

    private static final EventState BLOOD_MOON = new EventState("Blood Moon", 30);

    @Test
    void shouldFireAtTriggerMinute() {
        // when
        var delta = detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:30:05Z"));

        // then
        assertThat(delta).contains(new EventDelta("Blood Moon", 30, 0));
        assertThat(delta.get().startingNow()).isTrue();
    }

    @Test
    void shouldFireAtEachLeadOffset() {
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:29:00Z")))
                .map(EventDelta::minutesBefore).contains(1);
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:28:00Z")))
                .map(EventDelta::minutesBefore).contains(2);
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:25:10Z")))
                .map(EventDelta::minutesBefore).contains(5);
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:20:29Z")))
                .map(EventDelta::minutesBefore).contains(10);
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:15:00Z")))
                .map(EventDelta::minutesBefore).contains(15);
    }

    @Test
    void shouldNotFireOutsideToleranceWindow() {
        // when
        var delta = detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:25:30Z"));

        // then
        assertThat(delta).isEmpty();
    }

    @Test
    void shouldNotFireOnMinutesWithoutLeadOffset() {
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:27:00Z"))).isEmpty();
        assertThat(detector.detectEvent(BLOOD_MOON, Instant.parse("2026-06-01T12:31:00Z"))).isEmpty();
    }

    @Test
    void shouldWrapLeadOffsetsAcrossTheHour() {
        // given
        var event = new EventState("Night Event", 5);

        // when
        var delta = detector.detectEvent(event, Instant.parse("2026-06-01T11:55:00Z"));

        // then
        assertThat(delta).map(EventDelta::minutesBefore).contains(10);
    }

    @Test
    void shouldHitEveryLeadMinuteAtDefaultPollCadence() {
        // given
        var event = new EventState("Blood Moon", 0);
        var worstCaseGap = Duration.ofMillis(20_000 + 5_000);
        var tick = Instant.parse("2026-06-01T00:00:07.300Z");
        var end = tick.plus(Duration.ofHours(24));
        Map<Instant, Set<Integer>> leadsByHour = new TreeMap<>();

        // when
        while (tick.isBefore(end)) {
            var hour = tick.truncatedTo(ChronoUnit.HOURS);
            detector.detectEvent(event, tick).ifPresent(delta ->
                    leadsByHour.computeIfAbsent(hour, h -> new TreeSet<>()).add(delta.minutesBefore()));
            tick = tick.plus(worstCaseGap);
        }

        // then
        assertThat(leadsByHour).hasSize(24);
        assertThat(leadsByHour.values()).allSatisfy(leads -> assertThat(leads).containsExactly(0, 1, 2, 5, 10, 15));
    }

    @Test
    void shouldReturnEmptyWithoutEvent() {
        assertThat(detector.detectEvent(null, Instant.parse("2026-06-01T12:30:00Z"))).isEmpty();
    }

    @Test
    void shouldRejectToleranceOutsideOneMinute() {
        assertThatThrownBy(() -> new ChangeDetector(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChangeDetector(61)).isInstanceOf(IllegalArgumentException.class);
    }
}
