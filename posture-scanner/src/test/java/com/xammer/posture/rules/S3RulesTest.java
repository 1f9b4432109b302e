package com.xammer.posture.rules;

import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.engine.RuleEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class S3RulesTest {

    private final RuleEngine engine = new RuleEngine();

    private List<String> ruleIds(Resource bucket) {
        return engine.evaluate(bucket, S3Rules.BUCKET_RULES).stream()
                .map(Finding::getRuleId)
                .collect(Collectors.toList());
    }

    @Test
    void shouldAcceptCompliantBucket() {
        Resource bucket = Resource.builder(ServiceType.S3, S3Rules.BUCKET, "b1")
                .attribute(S3Rules.PUBLIC_ACL_PERMISSIONS, List.of())
                .attribute(S3Rules.POLICY_IS_PUBLIC, false)
                .attribute(S3Rules.ENCRYPTION_RULE_COUNT, 1)
                .attribute(S3Rules.VERSIONING_STATUS, "Enabled")
                .build();

        assertTrue(ruleIds(bucket).isEmpty());
    }

    @Test
    void shouldFlagPublicUnencryptedUnversionedBucket() {
        Resource bucket = Resource.builder(ServiceType.S3, S3Rules.BUCKET, "b2")
                .attribute(S3Rules.PUBLIC_ACL_PERMISSIONS, List.of("READ"))
                .attribute(S3Rules.POLICY_IS_PUBLIC, true)
                .attribute(S3Rules.ENCRYPTION_RULE_COUNT, 0)
                .attribute(S3Rules.VERSIONING_STATUS, "Suspended")
                .build();

        List<Finding> findings = engine.evaluate(bucket, S3Rules.BUCKET_RULES);

        assertEquals(List.of("s3-public-acl", "s3-public-policy", "s3-no-default-encryption", "s3-versioning-disabled"),
                findings.stream().map(Finding::getRuleId).collect(Collectors.toList()));
        assertEquals("Bucket b2 ACL allows public access ([READ]).", findings.get(0).getMessage());
    }

    @Test
    void shouldTreatMissingPolicyAsPrivateButMissingEncryptionAsRisk() {
        Resource bucket = Resource.builder(ServiceType.S3, S3Rules.BUCKET, "b3")
                .attribute(S3Rules.PUBLIC_ACL_PERMISSIONS, List.of())
                .build();

        assertEquals(List.of("s3-no-default-encryption", "s3-versioning-disabled"), ruleIds(bucket));
    }
}
