package com.xammer.posture.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A single reported result tied to one resource. Either a misconfiguration
 * produced by a rule, or the sentinel recorded when a service scan fails.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {

    public static final String SCAN_FAILURE_RULE_ID = "scan-failure";

    ServiceType service;
    String resourceId;
    String ruleId;
    Severity severity;
    String message;
    FindingKind kind;
    FailureCategory failureCategory;
    String errorDetail;

    public static Finding misconfiguration(ServiceType service, String resourceId, String ruleId,
                                           Severity severity, String message) {
        return new Finding(service, resourceId, ruleId, severity, message,
                FindingKind.MISCONFIGURATION, null, null);
    }

    public static Finding scanFailure(ServiceType service, FailureCategory category, String errorDetail) {
        String message = String.format("%s scan could not complete (%s)", service.getDisplayName(), category);
        return new Finding(service, service.getDisplayName(), SCAN_FAILURE_RULE_ID, Severity.WARNING, message,
                FindingKind.SCAN_FAILURE, category, errorDetail);
    }

    @JsonIgnore
    public boolean isScanFailure() {
        return kind == FindingKind.SCAN_FAILURE;
    }
}
