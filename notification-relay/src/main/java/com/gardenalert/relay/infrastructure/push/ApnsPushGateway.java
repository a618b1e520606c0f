package com.gardenalert.relay.infrastructure.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gardenalert.relay.application.config.RelayProperties;
import com.gardenalert.relay.domain.dispatch.NotificationPayload;
import com.gardenalert.relay.domain.dispatch.PushGateway;
import com.gardenalert.relay.domain.dispatch.PushResult;
import com.gardenalert.relay.domain.registry.DeviceTokens;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * APNs provider API over HTTP/2 with a bearer provider token. A non-2xx answer is a
 * failed send carrying the APNs {@code reason}; nothing is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "relay.push", name = "enabled", havingValue = "true")
public class ApnsPushGateway implements PushGateway {

    private final RestClient apnsRestClient;
    private final RelayProperties properties;

    @Override
    public PushResult send(NotificationPayload payload, String deviceToken) {
        var push = properties.push();
        try {
            apnsRestClient.post()
                    .uri("/3/device/{token}", deviceToken)
                    .header("apns-topic", push.topic())
                    .header("apns-push-type", "alert")
                    .header("apns-priority", "10")
                    .header("authorization", "bearer " + push.authToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(toBody(payload))
                    .retrieve()
                    .toBodilessEntity();
            return PushResult.sent();
        } catch (RestClientResponseException e) {
            var reason = reasonOf(e);
            log.debug("APNs rejected push for {}: {} {}", DeviceTokens.mask(deviceToken), e.getStatusCode(), reason);
            return PushResult.failed(e.getStatusCode().value() + " " + reason);
        } catch (RestClientException e) {
            return PushResult.failed(e.getMessage());
        }
    }

    static Map<String, Object> toBody(NotificationPayload payload) {
        var body = new LinkedHashMap<String, Object>(payload.data());
        body.put("aps", new Aps(
                new Alert(payload.title(), payload.body()),
                payload.badge(),
                payload.sound(),
                payload.threadId(),
                payload.category()));
        body.put("type", payload.type());
        body.put("notification_id", payload.notificationId());
        return body;
    }

    private static String reasonOf(RestClientResponseException e) {
        try {
            var error = e.getResponseBodyAs(ApnsError.class);
            return error != null && error.reason() != null ? error.reason() : e.getStatusText();
        } catch (RuntimeException parseFailure) {
            return e.getStatusText();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Aps(
            Alert alert,
            int badge,
            String sound,
            @JsonProperty("thread-id") String threadId,
            String category
    ) {}

    record Alert(String title, String body) {}

    record ApnsError(String reason) {}
}
