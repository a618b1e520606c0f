package com.gardenalert.relay.domain.catalog;

import java.util.Optional;

/**
 * Domain port for the timed-event feed. Empty when no event is scheduled.
 */
public interface EventFetcher {

    Optional<EventState> fetchEvent();
}
