package com.xammer.posture.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.EqualJitterBackoffStrategy;
import software.amazon.awssdk.core.retry.backoff.FullJitterBackoffStrategy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * Read-only AWS clients. Credentials come from the SDK default provider chain;
 * throttled calls are retried with jittered backoff inside each client.
 */
@Configuration
public class AwsConfig {

    @Value("${aws.region:us-east-1}")
    private String region;

    private final ScannerProperties properties;

    public AwsConfig(ScannerProperties properties) {
        this.properties = properties;
    }

    private DefaultCredentialsProvider getCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    ClientOverrideConfiguration overrideConfiguration() {
        ScannerProperties.Aws aws = properties.getAws();
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .numRetries(aws.getMaxRetries())
                .backoffStrategy(FullJitterBackoffStrategy.builder()
                        .baseDelay(aws.getBaseDelay())
                        .maxBackoffTime(aws.getMaxBackoff())
                        .build())
                .throttlingBackoffStrategy(EqualJitterBackoffStrategy.builder()
                        .baseDelay(aws.getThrottlingBaseDelay())
                        .maxBackoffTime(aws.getMaxBackoff())
                        .build())
                .build();
        return ClientOverrideConfiguration.builder()
                .retryPolicy(retryPolicy)
                .build();
    }

    @Bean
    public StsClient stsClient() {
        return StsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    @Bean
    public Ec2Client ec2Client() {
        return Ec2Client.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    @Bean
    public IamClient iamClient() {
        return IamClient.builder()
                .region(Region.AWS_GLOBAL)
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    @Bean
    public LambdaClient lambdaClient() {
        return LambdaClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    @Bean
    public RdsClient rdsClient() {
        return RdsClient.builder()
                .region(Region.of(region))
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }

    // Buckets outside the configured region are reached through cross-region access.
    @Bean
    public S3Client s3Client() {
        return S3Client.builder()
                .region(Region.of(region))
                .crossRegionAccessEnabled(true)
                .credentialsProvider(getCredentialsProvider())
                .overrideConfiguration(overrideConfiguration())
                .build();
    }
}
