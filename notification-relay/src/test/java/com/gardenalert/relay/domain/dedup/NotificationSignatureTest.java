package com.gardenalert.relay.domain.dedup;

import static com.gardenalert.relay.RelayFixtures.device;
import static org.assertj.core.api.Assertions.assertThat;

import com.gardenalert.common.model.ItemCategory;
import com.gardenalert.common.model.RarityTier;
import com.gardenalert.relay.domain.detection.EventDelta;
import com.gardenalert.relay.domain.detection.WeatherDelta;
import com.gardenalert.relay.domain.policy.IntentItem;
import com.gardenalert.relay.domain.policy.IntentKind;
import com.gardenalert.relay.domain.policy.NotificationIntent;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotificationSignatureTest {

    private static IntentItem item(String key) {
        return IntentItem.builder().key(key).displayName(key).category(ItemCategory.SEEDS)
                .rarity(RarityTier.RARE).quantity(1).build();
    }

    private static WeatherDelta weather(String id) {
        return WeatherDelta.builder().weatherId(id).name(id).active(true).build();
    }

    @Test
    void shouldIgnoreItemOrder() {
        // given
        var intent = NotificationIntent.builder()
                .device(device("token-signature"))
                .kind(IntentKind.CATEGORY_RESTOCK)
                .category(ItemCategory.SEEDS)
                .items(List.of(item("Tomato"), item("Apple")))
                .build();
        var reordered = intent.toBuilder().items(List.of(item("Apple"), item("Tomato"))).build();

        // then
        assertThat(NotificationSignature.of(intent)).isEqualTo(NotificationSignature.of(reordered));
        assertThat(NotificationSignature.of(intent).value()).isEqualTo("stock:seeds:Apple,Tomato");
    }

    @Test
    void shouldDistinguishStartedFromEndedWeather() {
        // given
        var started = NotificationIntent.builder()
                .device(device("token-signature"))
                .kind(IntentKind.WEATHER_STARTED)
                .weather(List.of(weather("rain"), weather("frost")))
                .build();
        var ended = started.toBuilder().kind(IntentKind.WEATHER_ENDED).build();

        // then
        assertThat(NotificationSignature.of(started).value()).isEqualTo("weather-started:frost,rain");
        assertThat(NotificationSignature.of(ended).value()).isEqualTo("weather-ended:frost,rain");
    }

    @Test
    void shouldKeyPremiumByTier() {
        // given
        var intent = NotificationIntent.builder()
                .device(device("token-signature"))
                .kind(IntentKind.PREMIUM_RESTOCK)
                .rarity(RarityTier.PRISMATIC)
                .items(List.of(item("Beanstalk")))
                .build();

        // then
        assertThat(NotificationSignature.of(intent).value()).isEqualTo("premium:prismatic:Beanstalk");
    }

    @Test
    void shouldKeyEventByLeadTime() {
        // given
        var intent = NotificationIntent.builder()
                .device(device("token-signature"))
                .kind(IntentKind.EVENT_UPCOMING)
                .event(new EventDelta("Blood Moon", 30, 5))
                .build();

        // then
        assertThat(NotificationSignature.of(intent)).hasToString("event:Blood Moon:5");
    }
}
