package com.xammer.posture.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one service scan: either every check completed, or the scan stopped
 * early and carries the findings gathered so far plus the failure sentinel.
 */
public abstract class ServiceScanResult {

    private final ServiceType service;
    private final List<Finding> misconfigurations;

    private ServiceScanResult(ServiceType service, List<Finding> misconfigurations) {
        this.service = Objects.requireNonNull(service, "service");
        this.misconfigurations = List.copyOf(misconfigurations);
    }

    public static ServiceScanResult completed(ServiceType service, List<Finding> findings) {
        return new Completed(service, findings);
    }

    public static ServiceScanResult failed(ServiceType service, List<Finding> findingsSoFar, Finding failure) {
        return new Failed(service, findingsSoFar, failure);
    }

    @JsonIgnore
    public ServiceType getService() {
        return service;
    }

    @JsonIgnore
    public List<Finding> getMisconfigurations() {
        return misconfigurations;
    }

    /** Misconfigurations in discovery order, followed by the failure sentinel if the scan failed. */
    @JsonProperty("findings")
    public abstract List<Finding> getFindings();

    @JsonProperty("failed")
    public abstract boolean isFailed();

    @JsonIgnore
    public abstract Optional<Finding> getFailure();

    public static final class Completed extends ServiceScanResult {

        private Completed(ServiceType service, List<Finding> findings) {
            super(service, findings);
        }

        @Override
        public List<Finding> getFindings() {
            return getMisconfigurations();
        }

        @Override
        public boolean isFailed() {
            return false;
        }

        @Override
        public Optional<Finding> getFailure() {
            return Optional.empty();
        }
    }

    public static final class Failed extends ServiceScanResult {

        private final Finding failure;
        private final List<Finding> findings;

        private Failed(ServiceType service, List<Finding> findingsSoFar, Finding failure) {
            super(service, findingsSoFar);
            if (!Objects.requireNonNull(failure, "failure").isScanFailure()) {
                throw new IllegalArgumentException("Failure finding must be of kind SCAN_FAILURE");
            }
            this.failure = failure;
            List<Finding> all = new ArrayList<>(getMisconfigurations());
            all.add(failure);
            this.findings = List.copyOf(all);
        }

        @Override
        public List<Finding> getFindings() {
            return findings;
        }

        @Override
        public boolean isFailed() {
            return true;
        }

        @Override
        public Optional<Finding> getFailure() {
            return Optional.of(failure);
        }
    }
}
