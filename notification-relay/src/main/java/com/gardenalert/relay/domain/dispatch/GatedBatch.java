package com.gardenalert.relay.domain.dispatch;

import java.util.List;

public record GatedBatch(List<Delivery> deliveries, int suppressed, int aborted) {

    public GatedBatch {
        deliveries = List.copyOf(deliveries);
    }

    public static GatedBatch empty() {
        return new GatedBatch(List.of(), 0, 0);
    }
}
