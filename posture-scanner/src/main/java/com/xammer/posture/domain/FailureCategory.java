package com.xammer.posture.domain;

public enum FailureCategory {
    ACCESS_DENIED,
    THROTTLING,
    TRANSPORT,
    TIMEOUT,
    UNKNOWN
}
