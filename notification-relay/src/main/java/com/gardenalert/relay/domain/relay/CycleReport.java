package com.gardenalert.relay.domain.relay;

import com.gardenalert.relay.domain.detection.DetectionMode;
import com.gardenalert.relay.domain.dispatch.DispatchSummary;
import java.time.Instant;
import lombok.Builder;

@Builder
public record CycleReport(
        DetectionMode mode,
        Instant startedAt,
        boolean catalogFresh,
        int catalogItems,
        int weatherConditions,
        int itemDeltas,
        int weatherDeltas,
        boolean eventFired,
        int intents,
        DispatchSummary dispatch
) {
}
