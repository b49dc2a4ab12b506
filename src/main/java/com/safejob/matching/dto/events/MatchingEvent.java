package com.safejob.matching.dto.events;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Fire-and-forget event published to downstream notification and analytics consumers.
 */
public interface MatchingEvent {

    /** Kafka record key; events of the same aggregate land on the same partition. */
    @JsonIgnore
    String key();

    @JsonIgnore
    String eventType();
}
