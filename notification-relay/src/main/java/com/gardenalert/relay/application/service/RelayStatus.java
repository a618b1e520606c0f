package com.gardenalert.relay.application.service;

import com.gardenalert.relay.domain.catalog.DataFreshness;
import com.gardenalert.relay.domain.relay.CycleReport;
import com.gardenalert.relay.domain.relay.CycleStage;
import java.time.Instant;
import lombok.Builder;

@Builder
public record RelayStatus(
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
        CycleReport lastCycle,
        Instant checkedAt
) {
}
