package com.xammer.posture.controller;

import com.xammer.posture.domain.ScanReport;
import com.xammer.posture.dto.RuleDescriptorDto;
import com.xammer.posture.service.ScanOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * HTTP access to the scanner when the application runs as a servlet application.
 */
@RestController
@RequestMapping("/api/posture")
public class ScanController {

    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);

    private final ScanOrchestrator scanOrchestrator;

    public ScanController(ScanOrchestrator scanOrchestrator) {
        this.scanOrchestrator = scanOrchestrator;
    }

    @GetMapping("/scan")
    public ResponseEntity<ScanReport> runScan() {
        logger.info("On-demand scan requested");
        ScanReport report = scanOrchestrator.runAllScans();
        logger.info("Returning {} findings ({} failed services)", report.totalFindings(), report.failedServices().size());
        return ResponseEntity.ok(report);
    }

    @GetMapping("/rules")
    public ResponseEntity<List<RuleDescriptorDto>> listRules() {
        List<RuleDescriptorDto> rules = scanOrchestrator.getScanners().stream()
                .flatMap(scanner -> scanner.getChecks().stream()
                        .flatMap(check -> check.getRules().stream()
                                .map(rule -> new RuleDescriptorDto(
                                        scanner.getService().getDisplayName(),
                                        check.getName(),
                                        rule.getId(),
                                        rule.getSeverity().name(),
                                        rule.getRequiredAttribute(),
                                        rule.getWhenMissing().name()))))
                .collect(Collectors.toList());
        return ResponseEntity.ok(rules);
    }
}
