package com.xammer.posture.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

    /** Run one task per service instead of one service at a time. */
    private boolean parallel = false;

    /** Wall-clock limit for a single service scan. */
    private Duration serviceTimeout = Duration.ofMinutes(5);

    /** Scan once at startup, print the report and exit. */
    private boolean runOnStartup = true;

    /** Service keys to scan (ec2, iam, lambda, rds, security-groups, s3). Empty means all. */
    private List<String> enabledServices = new ArrayList<>();

    private Report report = new Report();

    private Aws aws = new Aws();

    @Data
    public static class Report {
        /** console or json */
        private String format = "console";
    }

    @Data
    public static class Aws {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(100);
        private Duration throttlingBaseDelay = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(20);
    }
}
