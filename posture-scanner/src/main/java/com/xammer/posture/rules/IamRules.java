package com.xammer.posture.rules;

import com.xammer.posture.domain.PolicyStatement;
import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;

/**
 * IAM checks. Each resource kind (account summary, customer policy, access key,
 * user or role) has its own table.
 */
public final class IamRules {

    public static final String ACCOUNT_SUMMARY = "account-summary";
    public static final String POLICY = "policy";
    public static final String ACCESS_KEY = "access-key";
    public static final String PRINCIPAL = "principal";

    public static final String ROOT_RESOURCE_ID = "root";
    public static final String ADMINISTRATOR_ACCESS = "AdministratorAccess";

    public static final String ACCOUNT_MFA_ENABLED = "accountMfaEnabled";
    public static final String POLICY_ARN = "policyArn";
    public static final String STATEMENTS = "statements";
    public static final String USER_NAME = "userName";
    public static final String LAST_USED_DATE = "lastUsedDate";
    public static final String KEY_STATUS = "status";
    public static final String PRINCIPAL_TYPE = "principalType";
    public static final String ATTACHED_POLICY_NAMES = "attachedPolicyNames";

    // An unreported MFA flag is treated as disabled.
    public static final Rule ROOT_MFA_DISABLED = Rule.builder("iam-root-mfa-disabled")
            .inspects(ACCOUNT_MFA_ENABLED, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> r.integer(ACCOUNT_MFA_ENABLED).orElse(0) == 0)
            .message("Root account does not have MFA enabled. This is a security risk.")
            .severity(Severity.HIGH)
            .build();

    public static final Rule WILDCARD_ADMIN_POLICY = Rule.builder("iam-policy-wildcard-admin")
            .inspects(STATEMENTS, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.list(STATEMENTS, PolicyStatement.class).stream()
                    .anyMatch(PolicyStatement::isFullAdmin))
            .message("Overly permissive policy found: {id} allows all actions on all resources")
            .severity(Severity.HIGH)
            .build();

    // A key without a last-used date has never been used.
    public static final Rule ACCESS_KEY_NEVER_USED = Rule.builder("iam-access-key-never-used")
            .inspects(LAST_USED_DATE, MissingAttributePolicy.FAIL_CLOSED)
            .triggersWhen(r -> false)
            .message("Access key {id} for user {userName} has never been used.")
            .severity(Severity.WARNING)
            .build();

    public static final Rule ADMIN_ACCESS_ATTACHED = Rule.builder("iam-admin-access-attached")
            .inspects(ATTACHED_POLICY_NAMES, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.strings(ATTACHED_POLICY_NAMES).contains(ADMINISTRATOR_ACCESS))
            .message("IAM {principalType} '{id}' has AdministratorAccess attached.")
            .severity(Severity.HIGH)
            .build();

    public static final List<Rule> ACCOUNT_SUMMARY_RULES = List.of(ROOT_MFA_DISABLED);
    public static final List<Rule> POLICY_RULES = List.of(WILDCARD_ADMIN_POLICY);
    public static final List<Rule> ACCESS_KEY_RULES = List.of(ACCESS_KEY_NEVER_USED);
    public static final List<Rule> PRINCIPAL_RULES = List.of(ADMIN_ACCESS_ATTACHED);

    private IamRules() {
    }
}
