package com.driftops.model;

public enum RoutingArm {
    PRODUCTION,
    CANDIDATE
}
