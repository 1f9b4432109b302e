package com.xammer.posture.service;

import com.xammer.posture.domain.FailureCategory;
import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.ScanReport;
import com.xammer.posture.domain.ServiceScanResult;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.engine.RuleEngine;
import com.xammer.posture.lister.ResourceLister;
import com.xammer.posture.rules.Ec2Rules;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanOrchestratorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(6);
    private final ScanFailureClassifier classifier = new ScanFailureClassifier();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ServiceScanner scanner(ServiceType service, ResourceLister lister) {
        return new ServiceScanner(service, List.of(new ResourceCheck("items", lister, Ec2Rules.INSTANCE_RULES)),
                new RuleEngine(), classifier, LoggerFactory.getLogger("posture.scan." + service.getKey()));
    }

    private static ResourceLister exposed(String id) {
        return () -> Stream.of(ServiceScannerTest.instance(id, "5.5.5.5"));
    }

    private List<ServiceScanner> allServices(ResourceLister lambdaLister) {
        List<ServiceScanner> scanners = new ArrayList<>();
        for (ServiceType service : ServiceType.values()) {
            scanners.add(scanner(service, service == ServiceType.LAMBDA ? lambdaLister : exposed(service.getKey())));
        }
        // registration order must not matter
        Collections.reverse(scanners);
        return scanners;
    }

    @Test
    void shouldIsolateFailingServiceFromSiblings() {
        ResourceLister broken = () -> {
            throw SdkClientException.create("connection reset");
        };
        ScanOrchestrator orchestrator = new ScanOrchestrator(allServices(broken), executor, false,
                Duration.ofSeconds(10), classifier);

        ScanReport report = orchestrator.runAllScans();

        assertEquals(List.of("EC2", "IAM", "Lambda", "RDS", "SecurityGroups", "S3"),
                new ArrayList<>(report.getServices().keySet()));
        assertEquals(List.of(ServiceType.LAMBDA), report.failedServices());
        assertEquals(FailureCategory.TRANSPORT,
                report.findingsFor(ServiceType.LAMBDA).get(0).getFailureCategory());
        assertEquals(5, report.totalFindings());
        assertEquals(1, report.findingsFor(ServiceType.S3).size());
    }

    @Test
    void shouldKeepDeclaredOrderWhenRunningInParallel() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(allServices(exposed("fn")), executor, true,
                Duration.ofSeconds(10), classifier);

        ScanReport report = orchestrator.runAllScans();

        assertEquals(List.of("EC2", "IAM", "Lambda", "RDS", "SecurityGroups", "S3"),
                new ArrayList<>(report.getServices().keySet()));
        assertTrue(report.failedServices().isEmpty());
        assertEquals(6, report.totalFindings());
    }

    @Test
    void shouldRecordTimeoutForSlowService() {
        ResourceLister slow = () -> Stream.of("fn").map(id -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return ServiceScannerTest.instance(id, "6.6.6.6");
        });
        ScanOrchestrator orchestrator = new ScanOrchestrator(allServices(slow), executor, true,
                Duration.ofMillis(300), classifier);

        ScanReport report = orchestrator.runAllScans();

        assertEquals(List.of(ServiceType.LAMBDA), report.failedServices());
        List<Finding> lambda = report.findingsFor(ServiceType.LAMBDA);
        assertEquals(1, lambda.size());
        assertEquals(FailureCategory.TIMEOUT, lambda.get(0).getFailureCategory());
        assertFalse(report.findingsFor(ServiceType.EC2).isEmpty());
    }


    @Test
    void shouldKeepFindingsGatheredBeforeTimeout() {
        ResourceLister stallsAfterTwo = () -> Stream.concat(
                Stream.of(ServiceScannerTest.instance("i-1", "1.1.1.1"), ServiceScannerTest.instance("i-2", "2.2.2.2")),
                Stream.of("i-3").map(id -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                    return ServiceScannerTest.instance(id, "3.3.3.3");
                }));
        ScanOrchestrator orchestrator = new ScanOrchestrator(
                List.of(scanner(ServiceType.EC2, stallsAfterTwo), scanner(ServiceType.RDS, exposed("db"))),
                executor, false, Duration.ofMillis(500), classifier);

        ScanReport report = orchestrator.runAllScans();

        assertEquals(List.of(ServiceType.EC2), report.failedServices());
        List<Finding> ec2 = report.findingsFor(ServiceType.EC2);
        assertEquals(3, ec2.size());
        assertEquals("i-1", ec2.get(0).getResourceId());
        assertEquals("i-2", ec2.get(1).getResourceId());
        assertEquals(FailureCategory.TIMEOUT, ec2.get(2).getFailureCategory());
        assertEquals(3, report.totalFindings());
    }

    @Test
    void shouldReportScanThatFinishedAsTimedWaitExpiredAsCompleted() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(List.of(scanner(ServiceType.S3, exposed("b1"))),
                executor, false, Duration.ofSeconds(5), classifier) {
            @Override
            FutureTask<ServiceScanResult> newTask(Callable<ServiceScanResult> scan) {
                return new FutureTask<>(scan) {
                    @Override
                    public ServiceScanResult get(long timeout, TimeUnit unit)
                            throws InterruptedException, ExecutionException, TimeoutException {
                        get();
                        throw new TimeoutException("completed just after the deadline");
                    }
                };
            }
        };

        ScanReport report = orchestrator.runAllScans();

        assertTrue(report.failedServices().isEmpty());
        assertEquals(1, report.findingsFor(ServiceType.S3).size());
        assertFalse(report.findingsFor(ServiceType.S3).get(0).isScanFailure());
    }
    @Test
    void shouldRecordRejectedSubmissionAsFailure() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(
                List.of(scanner(ServiceType.RDS, exposed("db"))),
                task -> {
                    throw new RejectedExecutionException("queue full");
                },
                false, Duration.ofSeconds(1), classifier);

        ScanReport report = orchestrator.runAllScans();

        assertEquals(List.of(ServiceType.RDS), report.failedServices());
        assertEquals(FailureCategory.UNKNOWN, report.findingsFor(ServiceType.RDS).get(0).getFailureCategory());
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        List<ServiceScanner> duplicates = List.of(scanner(ServiceType.S3, Stream::empty), scanner(ServiceType.S3, Stream::empty));

        assertThrows(IllegalArgumentException.class,
                () -> new ScanOrchestrator(duplicates, executor, false, Duration.ofSeconds(1), classifier));
    }

    @Test
    void shouldProduceEmptyReportWithoutScanners() {
        ScanReport report = new ScanOrchestrator(List.of(), executor, true, Duration.ofSeconds(1), classifier).runAllScans();

        assertTrue(report.getServices().isEmpty());
        assertEquals(0, report.totalFindings());
    }
}
