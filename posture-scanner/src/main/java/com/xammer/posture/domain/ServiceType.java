package com.xammer.posture.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Scanned AWS services. Declaration order is the order scans run and the order
 * services appear in every report.
 */
public enum ServiceType {
    EC2("EC2", "ec2"),
    IAM("IAM", "iam"),
    LAMBDA("Lambda", "lambda"),
    RDS("RDS", "rds"),
    SECURITY_GROUPS("SecurityGroups", "security-groups"),
    S3("S3", "s3");

    private final String displayName;
    private final String key;

    ServiceType(String displayName, String key) {
        this.displayName = displayName;
        this.key = key;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ServiceType> fromKey(String value) {
        return Arrays.stream(values())
                .filter(s -> s.key.equalsIgnoreCase(value) || s.displayName.equalsIgnoreCase(value)
                        || s.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
