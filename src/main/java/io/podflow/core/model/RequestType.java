package io.podflow.core.model;

public enum RequestType {
    /** Broadcast write; reaches every shard of every selectable replica. */
    INDEX,
    /** Retry-safe read; served by exactly one replica per pod. */
    SEARCH
}
