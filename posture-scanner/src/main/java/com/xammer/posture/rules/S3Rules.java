package com.xammer.posture.rules;

import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;

public final class S3Rules {

    public static final String BUCKET = "bucket";

    public static final String ALL_USERS_URI = "http://acs.amazonaws.com/groups/global/AllUsers";
    public static final String VERSIONING_ENABLED = "Enabled";

    public static final String PUBLIC_ACL_PERMISSIONS = "publicAclPermissions";
    public static final String POLICY_IS_PUBLIC = "policyIsPublic";
    public static final String ENCRYPTION_RULE_COUNT = "encryptionRuleCount";
    public static final String VERSIONING_STATUS = "versioningStatus";

    public static final Rule PUBLIC_ACL = Rule.builder("s3-public-acl")
            .inspects(PUBLIC_ACL_PERMISSIONS, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> !r.strings(PUBLIC_ACL_PERMISSIONS).isEmpty())
            .message("Bucket {id} ACL allows public access ({publicAclPermissions}).")
            .severity(Severity.HIGH)
            .build();

    // No bucket policy at all is reported as a missing status.
    public static final Rule PUBLIC_POLICY = Rule.builder("s3-public-policy")
            .inspects(POLICY_IS_PUBLIC, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.bool(POLICY_IS_PUBLIC).orElse(false))
            .message("Bucket {id} policy allows public access.")
            .severity(Severity.HIGH)
            .build();

    public static final Rule NO_DEFAULT_ENCRYPTION = Rule.builder("s3-no-default-encryption")
            .inspects(ENCRYPTION_RULE_COUNT, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> r.integer(ENCRYPTION_RULE_COUNT).orElse(0) == 0)
            .message("Bucket {id} has no server-side encryption configured.")
            .severity(Severity.WARNING)
            .build();

    // Buckets that never had versioning report no status.
    public static final Rule VERSIONING_DISABLED = Rule.builder("s3-versioning-disabled")
            .inspects(VERSIONING_STATUS, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> !r.string(VERSIONING_STATUS).map(VERSIONING_ENABLED::equals).orElse(false))
            .message("Bucket {id} versioning is not enabled.")
            .severity(Severity.INFO)
            .build();

    public static final List<Rule> BUCKET_RULES = List.of(
            PUBLIC_ACL,
            PUBLIC_POLICY,
            NO_DEFAULT_ENCRYPTION,
            VERSIONING_DISABLED);

    private S3Rules() {
    }
}
