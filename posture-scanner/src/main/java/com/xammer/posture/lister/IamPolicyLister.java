package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.IamRules;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.Policy;
import software.amazon.awssdk.services.iam.model.PolicyScopeType;

import java.util.stream.Stream;

/**
 * Customer-managed policies with the statements of their default version.
 */
public class IamPolicyLister implements ResourceLister {

    private final IamClient iam;
    private final PolicyDocumentParser documentParser;

    public IamPolicyLister(IamClient iam, PolicyDocumentParser documentParser) {
        this.iam = iam;
        this.documentParser = documentParser;
    }

    @Override
    public Stream<Resource> list() {
        return iam.listPoliciesPaginator(r -> r.scope(PolicyScopeType.LOCAL)).policies().stream()
                .map(this::toResource);
    }

    private Resource toResource(Policy policy) {
        String document = iam.getPolicyVersion(r -> r.policyArn(policy.arn())
                .versionId(policy.defaultVersionId())).policyVersion().document();
        return Resource.builder(ServiceType.IAM, IamRules.POLICY, policy.policyName())
                .attribute(IamRules.POLICY_ARN, policy.arn())
                .attribute(IamRules.STATEMENTS, documentParser.parse(document))
                .build();
    }
}
