package com.xammer.posture.domain;

public enum Severity {
    INFO,
    WARNING,
    HIGH
}
