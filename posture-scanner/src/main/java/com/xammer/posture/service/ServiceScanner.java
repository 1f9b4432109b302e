package com.xammer.posture.service;

import com.xammer.posture.domain.FailureCategory;
import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceScanResult;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.engine.RuleEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;

/**
 * Drives every check of one service through the rule engine.
 * <p>
 * The first operational error stops the whole service: findings gathered so far are
 * kept and a single failure finding is appended. Nothing is retried here and nothing
 * is thrown past {@link #scan()}.
 */
public class ServiceScanner {

    private final ServiceType service;
    private final List<ResourceCheck> checks;
    private final RuleEngine ruleEngine;
    private final ScanFailureClassifier failureClassifier;
    private final Logger logger;

    public ServiceScanner(ServiceType service,
                          List<ResourceCheck> checks,
                          RuleEngine ruleEngine,
                          ScanFailureClassifier failureClassifier,
                          Logger logger) {
        this.service = service;
        this.checks = List.copyOf(checks);
        this.ruleEngine = ruleEngine;
        this.failureClassifier = failureClassifier;
        this.logger = logger;
    }

    public ServiceType getService() {
        return service;
    }

    public List<ResourceCheck> getChecks() {
        return checks;
    }

    public ServiceScanResult scan() {
        return scan(new ArrayList<>());
    }

    /**
     * Scans into the given list, so a caller that abandons the run can still read the
     * findings gathered so far. The list must tolerate reads from other threads.
     */
    public ServiceScanResult scan(List<Finding> findings) {
        logger.info("Starting {} misconfiguration scan...", service.getDisplayName());
        int scanned = 0;
        for (ResourceCheck check : checks) {
            try (Stream<Resource> resources = check.getLister().list()) {
                Iterator<Resource> it = resources.iterator();
                while (it.hasNext()) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new CancellationException(service.getDisplayName() + " scan was cancelled");
                    }
                    Resource resource = it.next();
                    scanned++;
                    logger.info("Scanning {} {}: {}", service.getDisplayName(), resource.getKind(), resource.getId());
                    List<Finding> resourceFindings = ruleEngine.evaluate(resource, check.getRules());
                    resourceFindings.forEach(f -> logger.warn("[{}] {}", f.getSeverity(), f.getMessage()));
                    findings.addAll(resourceFindings);
                }
            } catch (RuntimeException e) {
                FailureCategory category = failureClassifier.classify(e);
                logger.error("Error scanning {} during '{}' check ({}): {}",
                        service.getDisplayName(), check.getName(), category, e.getMessage(), e);
                return ServiceScanResult.failed(service, findings,
                        Finding.scanFailure(service, category, failureClassifier.describe(e)));
            }
        }
        logger.info("{} scan completed: {} resources, {} findings.", service.getDisplayName(), scanned, findings.size());
        return ServiceScanResult.completed(service, findings);
    }
}
