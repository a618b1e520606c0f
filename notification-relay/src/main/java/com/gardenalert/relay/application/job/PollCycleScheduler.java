package com.gardenalert.relay.application.job;

import com.gardenalert.relay.domain.relay.NotificationRelayEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the poll loop. Fixed delay measures from the end of the previous cycle, so
 * cycles never overlap even when a fetch hangs until its timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollCycleScheduler {

    private final NotificationRelayEngine engine;

    @Scheduled(
            fixedDelayString = "${relay.poll.interval-ms}",
            initialDelayString = "${relay.poll.initial-delay-ms}")
    public void poll() {
        try {
            engine.runCycle();
        } catch (RuntimeException e) {
            log.error("Poll cycle failed", e);
        }
    }
}
