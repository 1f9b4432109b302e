package com.xammer.posture.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.posture.domain.ScanReport;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;

@Component
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    public JsonReportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void render(ScanReport report, PrintWriter out) {
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            out.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise scan report: " + e.getOriginalMessage(), e);
        }
    }
}
