package com.gardenalert.relay.domain.detection;

import static com.gardenalert.relay.RelayFixtures.weather;
import static com.gardenalert.relay.RelayFixtures.weatherSnapshot;
import static org.assertj.core.api.Assertions.assertThat;

import com.gardenalert.relay.domain.catalog.WeatherSnapshot;
import org.junit.jupiter.api.Test;

class ChangeDetectorWeatherTest extends ChangeDetectorBaseTest {

    @Test
    void shouldFlagWeatherThatBecameActive() {
        // given
        var previous = weatherSnapshot(weather("rain", false));
        var current = weatherSnapshot(weather("rain", true));

        // when
        var deltas = detector.detectWeatherChanges(previous, current);

        // then
        assertThat(deltas).singleElement().satisfies(delta -> {
            assertThat(delta.weatherId()).isEqualTo("rain");
            assertThat(delta.active()).isTrue();
            assertThat(delta.wasActive()).isFalse();
        });
    }

    @Test
    void shouldTreatUnknownPreviousWeatherAsInactive() {
        // when
        var deltas = detector.detectWeatherChanges(
                WeatherSnapshot.empty(), weatherSnapshot(weather("thunderstorm", true), weather("frost", false)));

        // then
        assertThat(deltas).extracting(WeatherDelta::weatherId).containsExactly("thunderstorm");
    }

    @Test
    void shouldFlagActiveWeatherThatVanishedAsEnded() {
        // given
        var previous = weatherSnapshot(weather("rain", true));

        // when
        var deltas = detector.detectWeatherChanges(previous, WeatherSnapshot.empty());

        // then
        assertThat(deltas).singleElement().satisfies(delta -> {
            assertThat(delta.weatherId()).isEqualTo("rain");
            assertThat(delta.active()).isFalse();
            assertThat(delta.wasActive()).isTrue();
        });
    }

    @Test
    void shouldEmitStartedBeforeEnded() {
        // given
        var previous = weatherSnapshot(weather("rain", true), weather("frost", false), weather("heatwave", true));
        var current = weatherSnapshot(weather("rain", false), weather("frost", true));

        // when
        var deltas = detector.detectWeatherChanges(previous, current);

        // then
        assertThat(deltas).extracting(WeatherDelta::weatherId).containsExactly("frost", "rain", "heatwave");
        assertThat(deltas).extracting(WeatherDelta::active).containsExactly(true, false, false);
    }

    @Test
    void shouldIgnoreUnchangedWeather() {
        // given
        var snapshot = weatherSnapshot(weather("rain", true), weather("frost", false));

        // when
        var deltas = detector.detectWeatherChanges(snapshot, snapshot);

        // then
        assertThat(deltas).isEmpty();
    }
}
