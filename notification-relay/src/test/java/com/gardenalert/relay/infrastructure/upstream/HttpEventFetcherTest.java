package com.gardenalert.relay.infrastructure.upstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

import com.gardenalert.relay.RelayFixtures;
import com.gardenalert.relay.domain.catalog.EventState;
import com.gardenalert.relay.infrastructure.upstream.dto.EventResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HttpEventFetcherTest {

    @Mock
    private GameDataClient gameDataClient;

    @Test
    void shouldApplyTriggerMinuteCorrectionModuloHour() {
        // given
        var fetcher = new HttpEventFetcher(gameDataClient, RelayFixtures.properties("key", 3));
        given(gameDataClient.fetchEvent()).willReturn(new EventResponse(" Blood Moon ", 58));

        // when
        var event = fetcher.fetchEvent();

        // then
        assertThat(event).contains(new EventState("Blood Moon", 1));
    }

    @Test
    void shouldAllowNegativeCorrection() {
        // given
        var fetcher = new HttpEventFetcher(gameDataClient, RelayFixtures.properties("key", -5));
        given(gameDataClient.fetchEvent()).willReturn(new EventResponse("Bee Swarm", 2));

        // when
        var event = fetcher.fetchEvent();

        // then
        assertThat(event).map(EventState::correctedTriggerMinute).contains(57);
    }

    @Test
    void shouldReturnEmptyWhenNothingScheduled() {
        // given
        var fetcher = new HttpEventFetcher(gameDataClient, RelayFixtures.properties("key", 0));
        given(gameDataClient.fetchEvent()).willReturn(new EventResponse(null, null));

        // then
        assertThat(fetcher.fetchEvent()).isEmpty();
    }
}
