package com.gardenalert.relay.domain.dispatch;

/**
 * Outcome counts for one batch of intents.
 */
public record DispatchSummary(int sent, int failed, int suppressed, int aborted) {

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0, 0);
    }

    public DispatchSummary plus(DispatchSummary other) {
        return new DispatchSummary(
                sent + other.sent,
                failed + other.failed,
                suppressed + other.suppressed,
                aborted + other.aborted);
    }

    public int total() {
        return sent + failed + suppressed + aborted;
    }
}
