package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.S3Rules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Grant;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Buckets with their ACL grants to everyone, policy status, default encryption and
 * versioning. "Not configured" error codes become absent attributes; any other
 * error propagates.
 */
public class S3BucketLister implements ResourceLister {

    private static final Logger logger = LoggerFactory.getLogger(S3BucketLister.class);

    static final String NO_SUCH_BUCKET_POLICY = "NoSuchBucketPolicy";
    static final String ENCRYPTION_NOT_FOUND = "ServerSideEncryptionConfigurationNotFoundError";

    private final S3Client s3;

    public S3BucketLister(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public Stream<Resource> list() {
        return Stream.of(s3).flatMap(client -> client.listBuckets().buckets().stream())
                .map(bucket -> toResource(bucket.name()));
    }

    private Resource toResource(String bucket) {
        return Resource.builder(ServiceType.S3, S3Rules.BUCKET, bucket)
                .attribute(S3Rules.PUBLIC_ACL_PERMISSIONS, publicAclPermissions(bucket))
                .attribute(S3Rules.POLICY_IS_PUBLIC, policyIsPublic(bucket))
                .attribute(S3Rules.ENCRYPTION_RULE_COUNT, encryptionRuleCount(bucket))
                .attribute(S3Rules.VERSIONING_STATUS, s3.getBucketVersioning(r -> r.bucket(bucket)).statusAsString())
                .build();
    }

    private List<String> publicAclPermissions(String bucket) {
        return s3.getBucketAcl(r -> r.bucket(bucket)).grants().stream()
                .filter(grant -> grant.grantee() != null && S3Rules.ALL_USERS_URI.equals(grant.grantee().uri()))
                .map(Grant::permissionAsString)
                .distinct()
                .collect(Collectors.toList());
    }

    private Boolean policyIsPublic(String bucket) {
        try {
            return s3.getBucketPolicyStatus(r -> r.bucket(bucket)).policyStatus().isPublic();
        } catch (S3Exception e) {
            if (hasErrorCode(e, NO_SUCH_BUCKET_POLICY)) {
                logger.debug("No bucket policy found for {}", bucket);
                return null;
            }
            throw e;
        }
    }

    private Integer encryptionRuleCount(String bucket) {
        try {
            return s3.getBucketEncryption(r -> r.bucket(bucket)).serverSideEncryptionConfiguration().rules().size();
        } catch (S3Exception e) {
            if (hasErrorCode(e, ENCRYPTION_NOT_FOUND)) {
                logger.debug("No default encryption configured for {}", bucket);
                return null;
            }
            throw e;
        }
    }

    private static boolean hasErrorCode(S3Exception e, String code) {
        return e.awsErrorDetails() != null && code.equals(e.awsErrorDetails().errorCode());
    }
}
