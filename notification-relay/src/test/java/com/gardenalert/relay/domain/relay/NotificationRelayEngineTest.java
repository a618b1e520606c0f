package com.gardenalert.relay.domain.relay;

import static com.gardenalert.relay.RelayFixtures.NOW;
import static com.gardenalert.relay.RelayFixtures.catalog;
import static com.gardenalert.relay.RelayFixtures.device;
import static com.gardenalert.relay.RelayFixtures.seed;
import static com.gardenalert.relay.RelayFixtures.weather;
import static com.gardenalert.relay.RelayFixtures.weatherSnapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import com.gardenalert.common.model.RarityTier;
import com.gardenalert.relay.RelayFixtures;
import com.gardenalert.relay.domain.catalog.CatalogFetcher;
import com.gardenalert.relay.domain.catalog.CatalogItem;
import com.gardenalert.relay.domain.catalog.CatalogSnapshot;
import com.gardenalert.relay.domain.catalog.EventFetcher;
import com.gardenalert.relay.domain.catalog.EventState;
import com.gardenalert.relay.domain.catalog.SnapshotStore;
import com.gardenalert.relay.domain.catalog.WeatherFetcher;
import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.detection.ChangeDetector;
import com.gardenalert.relay.domain.detection.DetectionMode;
import com.gardenalert.relay.domain.dispatch.DispatchComposer;
import com.gardenalert.relay.domain.dispatch.NotificationDispatcher;
import com.gardenalert.relay.domain.dispatch.NotificationPayload;
import com.gardenalert.relay.domain.dispatch.PushGateway;
import com.gardenalert.relay.domain.dispatch.PushResult;
import com.gardenalert.relay.domain.exceptions.UpstreamUnavailableException;
import com.gardenalert.relay.domain.policy.NotificationPolicyEngine;
import com.gardenalert.relay.domain.registry.DeviceRegistration;
import com.gardenalert.relay.domain.registry.EventSettings;
import com.gardenalert.relay.infrastructure.memory.InMemoryDeviceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationRelayEngineTest {

    private static final String TOKEN = "token-engine-0001";

    @Mock
    private CatalogFetcher catalogFetcher;

    @Mock
    private WeatherFetcher weatherFetcher;

    @Mock
    private EventFetcher eventFetcher;

    @Mock
    private PushGateway pushGateway;

    private SnapshotStore snapshotStore;
    private InMemoryDeviceRegistry deviceRegistry;
    private DeduplicationCache deduplicationCache;
    private Counter cyclesCompletedCounter;

    @BeforeEach
    void setUp() {
        snapshotStore = new SnapshotStore();
        deviceRegistry = new InMemoryDeviceRegistry();
        deduplicationCache = new DeduplicationCache(Duration.ofMinutes(5));
        cyclesCompletedCounter = new SimpleMeterRegistry().counter("cycles");
    }

    private NotificationRelayEngine engineAt(Instant now) {
        var clock = Clock.fixed(now, ZoneOffset.UTC);
        var meterRegistry = new SimpleMeterRegistry();
        var dispatcher = new NotificationDispatcher(
                new DispatchComposer(),
                deduplicationCache,
                pushGateway,
                Runnable::run,
                clock,
                meterRegistry.counter("sent"),
                meterRegistry.counter("failed"),
                meterRegistry.counter("suppressed"),
                meterRegistry.counter("aborted"));
        return new NotificationRelayEngine(
                catalogFetcher,
                weatherFetcher,
                eventFetcher,
                snapshotStore,
                new ChangeDetector(30),
                new NotificationPolicyEngine(RelayFixtures.resolver(), RarityTier.PRISMATIC),
                dispatcher,
                deduplicationCache,
                deviceRegistry,
                Runnable::run,
                clock,
                cyclesCompletedCounter);
    }

    private void register(DeviceRegistration device) {
        deviceRegistry.upsert(device);
    }

    private static CatalogSnapshot twentySeeds() {
        var items = IntStream.rangeClosed(1, 19).mapToObj(i -> seed("Filler " + i, 1)).toList();
        var all = new ArrayList<CatalogItem>(items);
        all.add(seed("Tomato", 2));
        return CatalogSnapshot.of(all, NOW);
    }

    @Test
    void shouldNotifyFavoriteRestock() {
        // given
        register(device(TOKEN, "Tomato"));
        given(catalogFetcher.fetchCatalog()).willReturn(catalog(seed("Tomato", 0)), catalog(seed("Tomato", 2)));
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(NOW);
        engine.runCycle();

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.mode()).isEqualTo(DetectionMode.RESTOCK);
        assertThat(report.catalogFresh()).isTrue();
        assertThat(report.itemDeltas()).isEqualTo(1);
        assertThat(report.intents()).isEqualTo(1);
        assertThat(report.dispatch().sent()).isEqualTo(1);
        assertThat(engine.lastReport()).isEqualTo(report);
        assertThat(engine.stage()).isEqualTo(CycleStage.IDLE);
        assertThat(cyclesCompletedCounter.count()).isEqualTo(2.0);

        var payload = ArgumentCaptor.forClass(NotificationPayload.class);
        then(pushGateway).should().send(payload.capture(), eq(TOKEN));
        assertThat(payload.getValue().body()).isEqualTo("x2 Tomato 🍅 is now in stock.");
    }

    @Test
    void shouldSuppressRepeatedRestockWithinWindow() {
        // given
        register(device(TOKEN, "Apple"));
        given(catalogFetcher.fetchCatalog()).willReturn(catalog(seed("Apple", 3)));
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(NOW);
        engine.runCycle();

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.itemDeltas()).isEqualTo(1);
        assertThat(report.dispatch().suppressed()).isEqualTo(1);
        then(pushGateway).should(times(1)).send(any(NotificationPayload.class), anyString());
    }

    @Test
    void shouldKeepLastKnownGoodCatalogWhenFetchFails() {
        // given
        register(device(TOKEN, "Tomato"));
        given(catalogFetcher.fetchCatalog())
                .willReturn(twentySeeds())
                .willThrow(UpstreamUnavailableException.emptyResponse("stock"));
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(NOW);
        engine.runCycle();

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.catalogFresh()).isFalse();
        assertThat(report.catalogItems()).isEqualTo(20);
        assertThat(report.itemDeltas()).isZero();
        assertThat(snapshotStore.current().currentCatalog().size()).isEqualTo(20);
        then(pushGateway).should(times(1)).send(any(NotificationPayload.class), anyString());
    }

    @Test
    void shouldTreatFailedWeatherFetchAsNoWeather() {
        // given
        register(device(TOKEN));
        given(catalogFetcher.fetchCatalog()).willReturn(catalog());
        given(weatherFetcher.fetchWeather())
                .willReturn(weatherSnapshot(weather("rain", true)))
                .willThrow(UpstreamUnavailableException.emptyResponse("weather"));
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(NOW);
        engine.runCycle();

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.weatherConditions()).isZero();
        assertThat(report.weatherDeltas()).isEqualTo(1);
        var payload = ArgumentCaptor.forClass(NotificationPayload.class);
        then(pushGateway).should(times(2)).send(payload.capture(), anyString());
        assertThat(payload.getAllValues()).extracting(NotificationPayload::type)
                .containsExactly("weather_active", "weather_ended");
    }

    @Test
    void shouldFireEventForMatchingLead() {
        // given
        register(device(TOKEN).toBuilder().eventSettings(new EventSettings(true, 5, null)).build());
        given(eventFetcher.fetchEvent()).willReturn(Optional.of(new EventState("Blood Moon", 30)));
        given(catalogFetcher.fetchCatalog()).willReturn(catalog());
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(Instant.parse("2026-06-01T12:25:04Z"));
        engine.refreshEvent();

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.eventFired()).isTrue();
        assertThat(report.dispatch().sent()).isEqualTo(1);
    }

    @Test
    void shouldKeepPreviousEventWhenRefreshFails() {
        // given
        given(eventFetcher.fetchEvent())
                .willReturn(Optional.of(new EventState("Blood Moon", 30)))
                .willThrow(UpstreamUnavailableException.emptyResponse("event"));
        var engine = engineAt(NOW);
        engine.refreshEvent();

        // when
        engine.refreshEvent();

        // then
        assertThat(snapshotStore.currentEvent()).map(EventState::name).contains("Blood Moon");
    }

    @Test
    void shouldReannounceAvailableItemsOnDemand() {
        // given
        register(device(TOKEN, "Tomato"));
        given(catalogFetcher.fetchCatalog()).willReturn(catalog(seed("Tomato", 2)));
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        given(pushGateway.send(any(NotificationPayload.class), anyString())).willReturn(PushResult.sent());
        var engine = engineAt(NOW);
        engine.runCycle();
        var cleared = engine.clearNotificationCache();

        // when
        var report = engine.checkAvailability();

        // then
        assertThat(cleared).isEqualTo(1);
        assertThat(report.mode()).isEqualTo(DetectionMode.AVAILABILITY);
        assertThat(report.dispatch().sent()).isEqualTo(1);
        then(catalogFetcher).should(times(1)).fetchCatalog();
        then(pushGateway).should(times(2)).send(any(NotificationPayload.class), anyString());
    }

    @Test
    void shouldSkipPlanningWhenNothingChanged() {
        // given
        given(catalogFetcher.fetchCatalog()).willReturn(catalog());
        given(weatherFetcher.fetchWeather()).willReturn(weatherSnapshot());
        var engine = engineAt(NOW);

        // when
        var report = engine.runCycle();

        // then
        assertThat(report.intents()).isZero();
        assertThat(report.dispatch().total()).isZero();
        then(pushGateway).should(never()).send(any(NotificationPayload.class), anyString());
    }
}
