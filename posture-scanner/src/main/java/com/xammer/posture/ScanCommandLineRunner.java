package com.xammer.posture;

import com.xammer.posture.config.ScannerProperties;
import com.xammer.posture.domain.ScanReport;
import com.xammer.posture.report.ReportRenderer;
import com.xammer.posture.service.ScanOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One-shot scan: verify credentials, run every scanner, print the report.
 * Findings never change the exit code; only a scan that cannot start does.
 */
@Component
@ConditionalOnProperty(prefix = "scanner", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class ScanCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_CANNOT_START = 2;

    private static final Logger logger = LoggerFactory.getLogger(ScanCommandLineRunner.class);

    private final StsClient stsClient;
    private final ScanOrchestrator scanOrchestrator;
    private final ReportRenderer renderer;
    private final PrintWriter out;
    private int exitCode = 0;

    @Autowired
    public ScanCommandLineRunner(StsClient stsClient,
                                 ScanOrchestrator scanOrchestrator,
                                 List<ReportRenderer> renderers,
                                 ScannerProperties properties) {
        this(stsClient, scanOrchestrator, selectRenderer(renderers, properties.getReport().getFormat()),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    ScanCommandLineRunner(StsClient stsClient, ScanOrchestrator scanOrchestrator,
                          ReportRenderer renderer, PrintWriter out) {
        this.stsClient = stsClient;
        this.scanOrchestrator = scanOrchestrator;
        this.renderer = renderer;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        try {
            GetCallerIdentityResponse identity = stsClient.getCallerIdentity();
            logger.info("Scanning AWS account {} as {}", identity.account(), identity.arn());
        } catch (SdkException e) {
            logger.error("Unable to resolve AWS credentials, scan not started: {}", e.getMessage());
            exitCode = EXIT_CANNOT_START;
            return;
        }
        ScanReport report = scanOrchestrator.runAllScans();
        renderer.render(report, out);
        exitCode = 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static ReportRenderer selectRenderer(List<ReportRenderer> renderers, String format) {
        return renderers.stream()
                .filter(r -> r.format().equalsIgnoreCase(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported scanner.report.format: " + format));
    }
}
