package com.xammer.posture.rules;

import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;

public final class LambdaRules {

    public static final String FUNCTION = "function";

    public static final String KMS_KEY_ARN = "kmsKeyArn";
    public static final String RESERVED_CONCURRENCY = "reservedConcurrency";
    public static final String RESOURCE_POLICY = "resourcePolicy";
    public static final String RUNTIME = "runtime";

    public static final Rule ENV_NOT_KMS_ENCRYPTED = Rule.builder("lambda-env-not-kms-encrypted")
            .inspects(KMS_KEY_ARN, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> r.string(KMS_KEY_ARN).map(String::isBlank).orElse(true))
            .message("Lambda function {id}: environment variables are not encrypted with KMS.")
            .severity(Severity.WARNING)
            .build();

    public static final Rule NO_RESERVED_CONCURRENCY = Rule.builder("lambda-no-reserved-concurrency")
            .inspects(RESERVED_CONCURRENCY, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> false)
            .message("Lambda function {id}: no reserved concurrency set.")
            .severity(Severity.INFO)
            .build();

    public static final Rule RESOURCE_POLICY_ATTACHED = Rule.builder("lambda-resource-policy-attached")
            .inspects(RESOURCE_POLICY, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.string(RESOURCE_POLICY).filter(p -> !p.isBlank()).isPresent())
            .message("Lambda function {id} has a resource policy attached; review for overly permissive access.")
            .severity(Severity.INFO)
            .build();

    public static final List<Rule> FUNCTION_RULES = List.of(
            ENV_NOT_KMS_ENCRYPTED,
            NO_RESERVED_CONCURRENCY,
            RESOURCE_POLICY_ATTACHED);

    private LambdaRules() {
    }
}
