package com.gardenalert.relay.domain.dedup;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-device sliding-window suppression. Each device owns a ledger guarded by its own
 * monitor: operations on one device are serialized, different devices never contend.
 * Entries older than twice the window are purged whenever that device's ledger is written.
 */
public class DeduplicationCache {

    private final Duration window;
    private final Duration retention;
    private final ConcurrentHashMap<String, DeviceLedger> ledgers = new ConcurrentHashMap<>();

    public DeduplicationCache(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Dedup window must be positive: " + window);
        }
        this.window = window;
        this.retention = window.multipliedBy(2);
    }

    /**
     * @return false iff the same signature was recorded for this device less than one
     *         window before {@code now}
     */
    public boolean shouldSend(String deviceToken, NotificationSignature signature, Instant now) {
        var ledger = ledgers.get(deviceToken);
        return ledger == null || ledger.shouldSend(signature.value(), now);
    }

    public void record(String deviceToken, NotificationSignature signature, Instant now) {
        ledgerFor(deviceToken).record(signature.value(), now);
    }

    /**
     * {@link #shouldSend} and {@link #record} as one atomic step for the device.
     *
     * @return true if the caller now owns this send
     */
    public boolean tryAcquire(String deviceToken, NotificationSignature signature, Instant now) {
        return ledgerFor(deviceToken).tryAcquire(signature.value(), now);
    }

    public void clear() {
        ledgers.clear();
    }

    public int size() {
        return ledgers.values().stream().mapToInt(DeviceLedger::size).sum();
    }

    public int deviceCount() {
        return ledgers.size();
    }

    public Duration window() {
        return window;
    }

    private DeviceLedger ledgerFor(String deviceToken) {
        return ledgers.computeIfAbsent(deviceToken, k -> new DeviceLedger());
    }

    private final class DeviceLedger {

        private final Map<String, Instant> lastSent = new HashMap<>();

        synchronized boolean shouldSend(String signature, Instant now) {
            var recorded = lastSent.get(signature);
            return recorded == null || Duration.between(recorded, now).compareTo(window) >= 0;
        }

        synchronized void record(String signature, Instant now) {
            purgeOlderThanRetention(now);
            lastSent.put(signature, now);
        }

        synchronized boolean tryAcquire(String signature, Instant now) {
            if (!shouldSend(signature, now)) {
                return false;
            }
            record(signature, now);
            return true;
        }

        synchronized int size() {
            return lastSent.size();
        }

        private void purgeOlderThanRetention(Instant now) {
            var cutoff = now.minus(retention);
            lastSent.values().removeIf(sentAt -> sentAt.isBefore(cutoff));
        }
    }
}
