package com.xammer.posture.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Findings of one orchestrator run keyed by service, in declared service order.
 */
@Getter
public class ScanReport {

    private final Instant startedAt;
    private final Instant completedAt;
    @JsonIgnore
    private final Map<ServiceType, ServiceScanResult> results;

    public ScanReport(Instant startedAt, Instant completedAt, Map<ServiceType, ServiceScanResult> results) {
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    @JsonProperty("services")
    public Map<String, ServiceScanResult> getServices() {
        Map<String, ServiceScanResult> byName = new LinkedHashMap<>();
        results.forEach((service, result) -> byName.put(service.getDisplayName(), result));
        return byName;
    }

    @JsonIgnore
    public Map<String, List<Finding>> findingsByService() {
        Map<String, List<Finding>> byName = new LinkedHashMap<>();
        results.forEach((service, result) -> byName.put(service.getDisplayName(), result.getFindings()));
        return byName;
    }

    @JsonIgnore
    public List<Finding> findingsFor(ServiceType service) {
        ServiceScanResult result = results.get(service);
        return result == null ? Collections.emptyList() : result.getFindings();
    }

    @JsonProperty("failedServices")
    public List<ServiceType> failedServices() {
        return results.values().stream()
                .filter(ServiceScanResult::isFailed)
                .map(ServiceScanResult::getService)
                .collect(Collectors.toList());
    }

    @JsonProperty("totalFindings")
    public int totalFindings() {
        return results.values().stream().mapToInt(r -> r.getMisconfigurations().size()).sum();
    }

    @JsonProperty("severityCounts")
    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        results.values().stream()
                .flatMap(r -> r.getMisconfigurations().stream())
                .forEach(f -> counts.merge(f.getSeverity(), 1L, Long::sum));
        return counts;
    }
}
