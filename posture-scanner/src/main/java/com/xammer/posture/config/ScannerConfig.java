package com.xammer.posture.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.engine.RuleEngine;
import com.xammer.posture.lister.Ec2InstanceLister;
import com.xammer.posture.lister.IamAccessKeyLister;
import com.xammer.posture.lister.IamAccountSummaryLister;
import com.xammer.posture.lister.IamPolicyLister;
import com.xammer.posture.lister.IamPrincipalLister;
import com.xammer.posture.lister.LambdaFunctionLister;
import com.xammer.posture.lister.PolicyDocumentParser;
import com.xammer.posture.lister.RdsInstanceLister;
import com.xammer.posture.lister.S3BucketLister;
import com.xammer.posture.lister.SecurityGroupIngressLister;
import com.xammer.posture.rules.Ec2Rules;
import com.xammer.posture.rules.IamRules;
import com.xammer.posture.rules.LambdaRules;
import com.xammer.posture.rules.RdsRules;
import com.xammer.posture.rules.S3Rules;
import com.xammer.posture.rules.SecurityGroupRules;
import com.xammer.posture.service.ResourceCheck;
import com.xammer.posture.service.ScanFailureClassifier;
import com.xammer.posture.service.ScanOrchestrator;
import com.xammer.posture.service.ServiceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires each service's listers to its rule tables and registers the scanners with
 * the orchestrator.
 */
@Configuration
public class ScannerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScannerConfig.class);
    private static final String SCAN_LOGGER_PREFIX = "posture.scan.";

    @Bean
    public RuleEngine ruleEngine() {
        return new RuleEngine();
    }

    @Bean
    public ScanFailureClassifier scanFailureClassifier() {
        return new ScanFailureClassifier();
    }

    @Bean
    public PolicyDocumentParser policyDocumentParser(ObjectMapper objectMapper) {
        return new PolicyDocumentParser(objectMapper);
    }

    @Bean
    public ServiceScanner ec2Scanner(Ec2Client ec2Client, RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.EC2, ruleEngine, classifier, List.of(
                new ResourceCheck("instances", new Ec2InstanceLister(ec2Client), Ec2Rules.INSTANCE_RULES)));
    }

    @Bean
    public ServiceScanner iamScanner(IamClient iamClient, PolicyDocumentParser policyDocumentParser,
                                     RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.IAM, ruleEngine, classifier, List.of(
                new ResourceCheck("root account", new IamAccountSummaryLister(iamClient), IamRules.ACCOUNT_SUMMARY_RULES),
                new ResourceCheck("customer policies", new IamPolicyLister(iamClient, policyDocumentParser), IamRules.POLICY_RULES),
                new ResourceCheck("access keys", new IamAccessKeyLister(iamClient), IamRules.ACCESS_KEY_RULES),
                new ResourceCheck("users and roles", new IamPrincipalLister(iamClient), IamRules.PRINCIPAL_RULES)));
    }

    @Bean
    public ServiceScanner lambdaScanner(LambdaClient lambdaClient, RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.LAMBDA, ruleEngine, classifier, List.of(
                new ResourceCheck("functions", new LambdaFunctionLister(lambdaClient), LambdaRules.FUNCTION_RULES)));
    }

    @Bean
    public ServiceScanner rdsScanner(RdsClient rdsClient, RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.RDS, ruleEngine, classifier, List.of(
                new ResourceCheck("db instances", new RdsInstanceLister(rdsClient), RdsRules.DB_INSTANCE_RULES)));
    }

    @Bean
    public ServiceScanner securityGroupScanner(Ec2Client ec2Client, RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.SECURITY_GROUPS, ruleEngine, classifier, List.of(
                new ResourceCheck("ingress rules", new SecurityGroupIngressLister(ec2Client), SecurityGroupRules.INGRESS_RULES)));
    }

    @Bean
    public ServiceScanner s3Scanner(S3Client s3Client, RuleEngine ruleEngine, ScanFailureClassifier classifier) {
        return scanner(ServiceType.S3, ruleEngine, classifier, List.of(
                new ResourceCheck("buckets", new S3BucketLister(s3Client), S3Rules.BUCKET_RULES)));
    }

    @Bean
    public ScanOrchestrator scanOrchestrator(List<ServiceScanner> scanners,
                                             @Qualifier("scanTaskExecutor") TaskExecutor scanTaskExecutor,
                                             ScannerProperties properties,
                                             ScanFailureClassifier classifier) {
        Set<ServiceType> enabled = enabledServices(properties.getEnabledServices());
        List<ServiceScanner> registered = scanners.stream()
                .filter(s -> enabled.contains(s.getService()))
                .collect(Collectors.toList());
        logger.info("Registered scanners: {}", registered.stream()
                .map(s -> s.getService().getDisplayName()).collect(Collectors.joining(", ")));
        return new ScanOrchestrator(registered, scanTaskExecutor, properties.isParallel(),
                properties.getServiceTimeout(), classifier);
    }

    static Set<ServiceType> enabledServices(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return new LinkedHashSet<>(List.of(ServiceType.values()));
        }
        Set<ServiceType> enabled = new LinkedHashSet<>();
        for (String key : keys) {
            enabled.add(ServiceType.fromKey(key.trim())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown service in scanner.enabled-services: " + key)));
        }
        return enabled;
    }

    private static ServiceScanner scanner(ServiceType service, RuleEngine ruleEngine,
                                          ScanFailureClassifier classifier, List<ResourceCheck> checks) {
        return new ServiceScanner(service, checks, ruleEngine, classifier,
                LoggerFactory.getLogger(SCAN_LOGGER_PREFIX + service.getKey()));
    }
}
