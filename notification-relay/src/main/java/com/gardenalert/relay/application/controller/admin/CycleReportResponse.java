package com.gardenalert.relay.application.controller.admin;

import com.gardenalert.relay.domain.detection.DetectionMode;
import java.time.Instant;

public record CycleReportResponse(
        DetectionMode mode,
        Instant startedAt,
        boolean catalogFresh,
        int catalogItems,
        int itemDeltas,
        int weatherDeltas,
        boolean eventFired,
        int intents,
        int sent,
        int failed,
        int suppressed,
        int aborted) {}
