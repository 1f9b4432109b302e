package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.IamRules;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AccessKeyLastUsed;
import software.amazon.awssdk.services.iam.model.AccessKeyMetadata;

import java.time.Instant;
import java.util.stream.Stream;

public class IamAccessKeyLister implements ResourceLister {

    private final IamClient iam;

    public IamAccessKeyLister(IamClient iam) {
        this.iam = iam;
    }

    @Override
    public Stream<Resource> list() {
        return iam.listUsersPaginator().users().stream()
                .flatMap(user -> iam.listAccessKeysPaginator(r -> r.userName(user.userName()))
                        .accessKeyMetadata().stream())
                .map(this::toResource);
    }

    private Resource toResource(AccessKeyMetadata key) {
        AccessKeyLastUsed lastUsed = iam.getAccessKeyLastUsed(r -> r.accessKeyId(key.accessKeyId()))
                .accessKeyLastUsed();
        Instant lastUsedDate = lastUsed == null ? null : lastUsed.lastUsedDate();
        return Resource.builder(ServiceType.IAM, IamRules.ACCESS_KEY, key.accessKeyId())
                .attribute(IamRules.USER_NAME, key.userName())
                .attribute(IamRules.KEY_STATUS, key.statusAsString())
                .attribute(IamRules.LAST_USED_DATE, lastUsedDate)
                .build();
    }
}
