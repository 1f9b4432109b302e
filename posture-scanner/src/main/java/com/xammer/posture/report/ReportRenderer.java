package com.xammer.posture.report;

import com.xammer.posture.domain.ScanReport;

import java.io.PrintWriter;

/**
 * Renders a finished scan report. Implementations are pure functions of the report.
 */
public interface ReportRenderer {

    /** Value of {@code scanner.report.format} that selects this renderer. */
    String format();

    void render(ScanReport report, PrintWriter out);
}
