package com.gardenalert.relay.application.controller.status;

import com.gardenalert.relay.application.controller.admin.CycleReportResponse;
import com.gardenalert.relay.domain.catalog.DataFreshness;
import com.gardenalert.relay.domain.relay.CycleStage;
import java.time.Instant;

public record StatusResponse(
        int registeredDevices,
        int catalogItems,
        int weatherConditions,
        Instant catalogUpdatedAt,
        Instant weatherUpdatedAt,
        DataFreshness freshness,
        String eventName,
        Integer eventTriggerMinute,
        int dedupEntries,
        CycleStage cycleStage,
        CycleReportResponse lastCycle,
        Instant checkedAt) {}
