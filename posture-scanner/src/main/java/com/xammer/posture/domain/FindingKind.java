package com.xammer.posture.domain;

/**
 * Separates a real misconfiguration from a service scan that could not complete.
 */
public enum FindingKind {
    MISCONFIGURATION,
    SCAN_FAILURE
}
