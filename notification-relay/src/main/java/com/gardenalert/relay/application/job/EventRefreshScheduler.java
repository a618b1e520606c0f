package com.gardenalert.relay.application.job;

import com.gardenalert.relay.domain.relay.NotificationRelayEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventRefreshScheduler {

    private final NotificationRelayEngine engine;

    @Scheduled(
            fixedDelayString = "${relay.event.refresh-interval-ms}",
            initialDelayString = "${relay.poll.initial-delay-ms}")
    public void refresh() {
        engine.refreshEvent();
    }
}
