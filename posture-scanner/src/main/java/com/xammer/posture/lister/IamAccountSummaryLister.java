package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.IamRules;
import software.amazon.awssdk.services.iam.IamClient;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Yields the single account-level summary resource.
 */
public class IamAccountSummaryLister implements ResourceLister {

    static final String ACCOUNT_MFA_ENABLED_KEY = "AccountMFAEnabled";

    private final IamClient iam;

    public IamAccountSummaryLister(IamClient iam) {
        this.iam = iam;
    }

    @Override
    public Stream<Resource> list() {
        return Stream.of(iam).map(client -> {
            Map<String, Integer> summary = client.getAccountSummary().summaryMapAsStrings();
            return Resource.builder(ServiceType.IAM, IamRules.ACCOUNT_SUMMARY, IamRules.ROOT_RESOURCE_ID)
                    .attribute(IamRules.ACCOUNT_MFA_ENABLED, summary.get(ACCOUNT_MFA_ENABLED_KEY))
                    .build();
        });
    }
}
