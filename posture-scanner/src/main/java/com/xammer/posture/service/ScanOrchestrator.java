package com.xammer.posture.service;

import com.xammer.posture.domain.FailureCategory;
import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.ScanReport;
import com.xammer.posture.domain.ServiceScanResult;
import com.xammer.posture.domain.ServiceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs every registered service scanner once and merges the results into a
 * {@link ScanReport}. Services are isolated from one another: a failure or timeout
 * only marks that service as failed. A timed-out service keeps the findings it had
 * gathered before it was cancelled.
 */
public class ScanOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final List<ServiceScanner> scanners;
    private final Executor executor;
    private final boolean parallel;
    private final Duration serviceTimeout;
    private final ScanFailureClassifier failureClassifier;

    public ScanOrchestrator(List<ServiceScanner> scanners,
                            Executor executor,
                            boolean parallel,
                            Duration serviceTimeout,
                            ScanFailureClassifier failureClassifier) {
        List<ServiceScanner> ordered = scanners.stream()
                .sorted(Comparator.comparing(ServiceScanner::getService))
                .collect(Collectors.toList());
        long distinct = ordered.stream().map(ServiceScanner::getService).distinct().count();
        if (distinct != ordered.size()) {
            throw new IllegalArgumentException("Each service may only be registered once");
        }
        this.scanners = Collections.unmodifiableList(ordered);
        this.executor = executor;
        this.parallel = parallel;
        this.serviceTimeout = serviceTimeout;
        this.failureClassifier = failureClassifier;
    }

    public List<ServiceScanner> getScanners() {
        return scanners;
    }

    public ScanReport runAllScans() {
        Instant startedAt = Instant.now();
        logger.info("===== Starting AWS Misconfiguration Scan ({} services, {}) =====",
                scanners.size(), parallel ? "parallel" : "sequential");

        Map<ServiceType, ServiceScanResult> results = new LinkedHashMap<>();
        if (parallel) {
            Map<ServiceType, Submission> submissions = new LinkedHashMap<>();
            for (ServiceScanner scanner : scanners) {
                submissions.put(scanner.getService(), submit(scanner));
            }
            submissions.forEach((service, submission) -> results.put(service, await(service, submission)));
        } else {
            for (ServiceScanner scanner : scanners) {
                logger.info("Running {} Scanner...", scanner.getService().getDisplayName());
                results.put(scanner.getService(), await(scanner.getService(), submit(scanner)));
            }
        }

        ScanReport report = new ScanReport(startedAt, Instant.now(), results);
        logger.info("===== AWS Misconfiguration Scan Completed: {} findings, {} failed services =====",
                report.totalFindings(), report.failedServices().size());
        return report;
    }

    private Submission submit(ServiceScanner scanner) {
        List<Finding> progress = Collections.synchronizedList(new ArrayList<>());
        FutureTask<ServiceScanResult> task = newTask(() -> scanner.scan(progress));
        long deadline = System.nanoTime() + serviceTimeout.toNanos();
        try {
            executor.execute(task);
            return new Submission(task, progress, deadline, null);
        } catch (RejectedExecutionException e) {
            return new Submission(task, progress, deadline, e);
        }
    }

    FutureTask<ServiceScanResult> newTask(Callable<ServiceScanResult> scan) {
        return new FutureTask<>(scan);
    }

    private ServiceScanResult await(ServiceType service, Submission submission) {
        if (submission.rejection != null) {
            logger.error("{} scan could not be scheduled", service.getDisplayName(), submission.rejection);
            return failure(service, Collections.emptyList(), failureClassifier.classify(submission.rejection),
                    failureClassifier.describe(submission.rejection));
        }
        try {
            long remaining = Math.max(0L, submission.deadlineNanos - System.nanoTime());
            return submission.task.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (!submission.task.cancel(true)) {
                // Finished between the timed wait and the cancel.
                return completedResult(service, submission);
            }
            List<Finding> partial = List.copyOf(submission.progress);
            logger.error("{} scan exceeded its timeout of {} and was cancelled with {} findings gathered",
                    service.getDisplayName(), serviceTimeout, partial.size());
            return failure(service, partial, FailureCategory.TIMEOUT,
                    service.getDisplayName() + " scan exceeded timeout of " + serviceTimeout);
        } catch (ExecutionException e) {
            return executionFailure(service, submission, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submission.task.cancel(true);
            logger.error("Interrupted while waiting for {} scan", service.getDisplayName());
            return failure(service, List.copyOf(submission.progress), FailureCategory.TIMEOUT,
                    "Interrupted while waiting for scan");
        }
    }

    private ServiceScanResult completedResult(ServiceType service, Submission submission) {
        try {
            return submission.task.get();
        } catch (ExecutionException e) {
            return executionFailure(service, submission, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(service, List.copyOf(submission.progress), FailureCategory.TIMEOUT,
                    "Interrupted while waiting for scan");
        }
    }

    private ServiceScanResult executionFailure(ServiceType service, Submission submission, ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        logger.error("{} scan terminated unexpectedly", service.getDisplayName(), cause);
        return failure(service, List.copyOf(submission.progress), failureClassifier.classify(cause),
                failureClassifier.describe(cause));
    }

    private static ServiceScanResult failure(ServiceType service, List<Finding> findingsSoFar,
                                             FailureCategory category, String detail) {
        return ServiceScanResult.failed(service, findingsSoFar, Finding.scanFailure(service, category, detail));
    }

    private static final class Submission {
        private final FutureTask<ServiceScanResult> task;
        private final List<Finding> progress;
        private final long deadlineNanos;
        private final RejectedExecutionException rejection;

        private Submission(FutureTask<ServiceScanResult> task, List<Finding> progress, long deadlineNanos,
                           RejectedExecutionException rejection) {
            this.task = task;
            this.progress = progress;
            this.deadlineNanos = deadlineNanos;
            this.rejection = rejection;
        }
    }
}
