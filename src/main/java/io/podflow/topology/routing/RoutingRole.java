package io.podflow.topology.routing;

public enum RoutingRole {
    /** Fans requests out to the group's members. */
    HEAD,
    /** Collects the members' answers into one. */
    TAIL
}
