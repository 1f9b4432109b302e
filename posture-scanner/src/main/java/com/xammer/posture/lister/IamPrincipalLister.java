package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.IamRules;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AttachedPolicy;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * IAM users followed by IAM roles, each with the names of its attached managed policies.
 */
public class IamPrincipalLister implements ResourceLister {

    static final String USER = "User";
    static final String ROLE = "Role";

    private final IamClient iam;

    public IamPrincipalLister(IamClient iam) {
        this.iam = iam;
    }

    @Override
    public Stream<Resource> list() {
        Stream<Resource> users = iam.listUsersPaginator().users().stream()
                .map(user -> principal(USER, user.userName(),
                        iam.listAttachedUserPoliciesPaginator(r -> r.userName(user.userName()))
                                .attachedPolicies().stream()));
        // Roles are only paged once users are exhausted.
        Stream<Resource> roles = Stream.of(iam).flatMap(client -> client.listRolesPaginator().roles().stream())
                .map(role -> principal(ROLE, role.roleName(),
                        iam.listAttachedRolePoliciesPaginator(r -> r.roleName(role.roleName()))
                                .attachedPolicies().stream()));
        return Stream.concat(users, roles);
    }

    private static Resource principal(String type, String name, Stream<AttachedPolicy> attached) {
        List<String> policyNames = attached.map(AttachedPolicy::policyName).collect(Collectors.toList());
        return Resource.builder(ServiceType.IAM, IamRules.PRINCIPAL, name)
                .attribute(IamRules.PRINCIPAL_TYPE, type)
                .attribute(IamRules.ATTACHED_POLICY_NAMES, policyNames)
                .build();
    }
}
