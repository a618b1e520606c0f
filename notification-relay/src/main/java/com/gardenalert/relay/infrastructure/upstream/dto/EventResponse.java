package com.gardenalert.relay.infrastructure.upstream.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventResponse(
        @JsonProperty("event_name") String eventName,
        @JsonProperty("trigger_minute") Integer triggerMinute
) {
}
