package com.diskwatcher.app.service;

public enum TransitionResult {
    APPLIED,
    /** The job was not in a state that allows the transition (e.g. already terminal). */
    CONFLICT
}
