package com.gardenalert.relay.application.controller.device;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.gardenalert.relay.application.controller.RelayControllerBaseTest;
import com.gardenalert.relay.domain.registry.DeviceRegistry;
import com.gardenalert.relay.domain.registry.WeatherMode;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

class DeviceControllerTest extends RelayControllerBaseTest {

    private static final String DEVICES_PATH = "/api/v1/devices";

    @Autowired
    private DeviceRegistry deviceRegistry;

    @SneakyThrows
    @Test
    void shouldRegisterDeviceWithMaskedTokenInResponse() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "deviceToken": "device-controller-token-0001",
                                  "platform": "ios",
                                  "favoriteItems": ["Tomato", "Apple"],
                                  "favoriteWeather": ["rain"],
                                  "weatherSettings": {"enabled": true, "mode": "FAVORITES_ONLY"},
                                  "eventSettings": {"enabled": true, "leadMinutes": 10, "sound": "alarm"}
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deviceToken", is("device-con...")))
                .andExpect(jsonPath("$.favoriteItemCount", is(2)))
                .andExpect(jsonPath("$.favoriteWeatherCount", is(1)))
                .andExpect(jsonPath("$.notificationsEnabled", is(true)))
                .andExpect(jsonPath("$.eventsEnabled", is(true)))
                .andExpect(jsonPath("$.registeredAt", notNullValue()));

        var stored = deviceRegistry.get("device-controller-token-0001").orElseThrow();
        assertThat(stored.weatherSettings().mode()).isEqualTo(WeatherMode.FAVORITES_ONLY);
        assertThat(stored.eventSettings().leadMinutes()).isEqualTo(10);
        assertThat(stored.eventSettings().sound()).isEqualTo("alarm");
    }

    @SneakyThrows
    @Test
    void shouldApplyDefaultsForOmittedSettings() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceToken\": \"device-controller-token-0002\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.favoriteItemCount", is(0)))
                .andExpect(jsonPath("$.notificationsEnabled", is(true)))
                .andExpect(jsonPath("$.weatherEnabled", is(true)))
                .andExpect(jsonPath("$.eventsEnabled", is(false)));
    }

    @SneakyThrows
    @Test
    void shouldRejectBlankDeviceToken() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceToken\": \" \", \"favoriteItems\": [\"Tomato\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")))
                .andExpect(jsonPath("$.errors", hasItem(startsWith("deviceToken"))));
    }

    @SneakyThrows
    @Test
    void shouldRejectUnsupportedLeadTime() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceToken": "device-controller-token-0003",
                                 "eventSettings": {"enabled": true, "leadMinutes": 7}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REGISTRATION")));
    }

    @SneakyThrows
    @Test
    void shouldRejectUnknownCategorySound() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceToken": "device-controller-token-0004",
                                 "notificationSettings": {"categorySounds": {"pets": "chime"}}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("INVALID_REGISTRATION")));
    }

    @SneakyThrows
    @Test
    void shouldRejectUnknownWeatherMode() {
        mockMvc.perform(post(DEVICES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"deviceToken": "device-controller-token-0005",
                                 "weatherSettings": {"mode": "SOMETIMES"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));
    }
}
