package com.xammer.posture.report;

import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.ScanReport;
import com.xammer.posture.domain.ServiceScanResult;
import com.xammer.posture.domain.Severity;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.util.Map;

@Component
public class ConsoleReportRenderer implements ReportRenderer {

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void render(ScanReport report, PrintWriter out) {
        out.println();
        out.println("=== Misconfiguration Findings Summary ===");
        for (Map.Entry<String, ServiceScanResult> entry : report.getServices().entrySet()) {
            ServiceScanResult result = entry.getValue();
            out.println();
            out.println("Service: " + entry.getKey());
            if (result.getMisconfigurations().isEmpty() && !result.isFailed()) {
                out.println("  No misconfigurations found.");
            }
            for (Finding finding : result.getMisconfigurations()) {
                out.printf("  - [%s] %s: %s (%s)%n",
                        finding.getSeverity(), finding.getResourceId(), finding.getMessage(), finding.getRuleId());
            }
            result.getFailure().ifPresent(failure -> out.printf("  ! SCAN FAILED (%s): %s%n",
                    failure.getFailureCategory(), failure.getErrorDetail()));
        }
        Map<Severity, Long> counts = report.countBySeverity();
        out.println();
        out.printf("Total: %d findings (high: %d, warning: %d, info: %d), %d failed services%n",
                report.totalFindings(),
                counts.get(Severity.HIGH), counts.get(Severity.WARNING), counts.get(Severity.INFO),
                report.failedServices().size());
        out.flush();
    }
}
