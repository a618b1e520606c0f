package com.gardenalert.relay.domain.relay;

public enum CycleStage {
    IDLE,
    SNAPSHOT_SWAPPED,
    DIFFED,
    PLANNED,
    DEDUPED,
    DISPATCHED
}
