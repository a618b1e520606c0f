package com.gardenalert.relay.domain.dispatch;

import com.gardenalert.relay.domain.dedup.DeduplicationCache;
import com.gardenalert.relay.domain.dedup.NotificationSignature;
import com.gardenalert.relay.domain.policy.NotificationIntent;
import com.gardenalert.relay.domain.registry.DeviceTokens;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Two phases. {@link #gate} composes each intent and claims its signature in the dedup
 * cache, in plan order. {@link #deliver} sends the survivors, one task per device on the
 * dispatch executor; a device's sends stay in order and one device's failure never
 * affects another's.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final DispatchComposer composer;
    private final DeduplicationCache deduplicationCache;
    private final PushGateway pushGateway;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Counter notificationsSentCounter;
    private final Counter notificationsFailedCounter;
    private final Counter notificationsSuppressedCounter;
    private final Counter notificationsAbortedCounter;

    public DispatchSummary dispatch(List<NotificationIntent> intents) {
        return deliver(gate(intents));
    }

    public GatedBatch gate(List<NotificationIntent> intents) {
        var deliveries = new ArrayList<Delivery>();
        var suppressed = 0;
        var aborted = 0;
        var now = clock.instant();

        for (var intent : intents) {
            var token = intent.deviceToken();
            NotificationPayload payload;
            try {
                payload = composer.compose(intent);
            } catch (RuntimeException e) {
                log.error("Could not compose {} notification for {}: {}",
                        intent.kind(), DeviceTokens.mask(token), e.getMessage());
                notificationsAbortedCounter.increment();
                aborted++;
                continue;
            }

            var signature = NotificationSignature.of(intent);
            if (!deduplicationCache.tryAcquire(token, signature, now)) {
                log.info("Duplicate blocked: {} for {}", signature, DeviceTokens.mask(token));
                notificationsSuppressedCounter.increment();
                suppressed++;
                continue;
            }
            deliveries.add(new Delivery(token, intent.kind(), payload));
        }
        return new GatedBatch(deliveries, suppressed, aborted);
    }

    public DispatchSummary deliver(GatedBatch batch) {
        var byDevice = new LinkedHashMap<String, List<Delivery>>();
        for (var delivery : batch.deliveries()) {
            byDevice.computeIfAbsent(delivery.deviceToken(), k -> new ArrayList<>()).add(delivery);
        }

        var futures = byDevice.values().stream()
                .map(deviceDeliveries -> CompletableFuture.supplyAsync(
                        () -> deliverToDevice(deviceDeliveries), dispatchExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var summary = futures.stream()
                .map(CompletableFuture::join)
                .reduce(new DispatchSummary(0, 0, batch.suppressed(), batch.aborted()), DispatchSummary::plus);
        if (summary.total() > 0) {
            log.info("Dispatch complete for {} devices: {} sent, {} failed, {} suppressed, {} aborted",
                    byDevice.size(), summary.sent(), summary.failed(), summary.suppressed(), summary.aborted());
        }
        return summary;
    }

    private DispatchSummary deliverToDevice(List<Delivery> deliveries) {
        var sent = 0;
        var failed = 0;
        for (var delivery : deliveries) {
            if (send(delivery)) {
                sent++;
            } else {
                failed++;
            }
        }
        return new DispatchSummary(sent, failed, 0, 0);
    }

    private boolean send(Delivery delivery) {
        var masked = DeviceTokens.mask(delivery.deviceToken());
        PushResult result;
        try {
            result = pushGateway.send(delivery.payload(), delivery.deviceToken());
        } catch (RuntimeException e) {
            result = PushResult.failed(e.getMessage());
        }

        if (result.isSuccess()) {
            log.info("Sent {} notification '{}' to {}", delivery.kind(), delivery.payload().title(), masked);
            notificationsSentCounter.increment();
            return true;
        }
        log.warn("Failed to send {} notification to {}: {}", delivery.kind(), masked, result.failureReason());
        notificationsFailedCounter.increment();
        return false;
    }
}
