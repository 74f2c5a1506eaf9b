package com.mailattribution.collector;

/** Lifecycle of the tracking-network collector. */
public enum CollectorState {
    IDLE,
    FETCHING_FULL,
    FETCHING_INCREMENTAL,
    STOPPED
}
