package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.SecurityGroupRules;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.IpPermission;
import software.amazon.awssdk.services.ec2.model.IpRange;
import software.amazon.awssdk.services.ec2.model.Ipv6Range;
import software.amazon.awssdk.services.ec2.model.SecurityGroup;

import java.util.stream.Stream;

/**
 * Flattens every security group into one resource per ingress permission and CIDR range.
 */
public class SecurityGroupIngressLister implements ResourceLister {

    private final Ec2Client ec2;

    public SecurityGroupIngressLister(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @Override
    public Stream<Resource> list() {
        return ec2.describeSecurityGroupsPaginator().securityGroups().stream()
                .flatMap(SecurityGroupIngressLister::ingressEntries);
    }

    static Stream<Resource> ingressEntries(SecurityGroup group) {
        return group.ipPermissions().stream().flatMap(permission -> Stream.concat(
                permission.ipRanges().stream().map(IpRange::cidrIp),
                permission.ipv6Ranges().stream().map(Ipv6Range::cidrIpv6))
                .map(cidr -> toResource(group, permission, cidr)));
    }

    static Resource toResource(SecurityGroup group, IpPermission permission, String cidr) {
        String portRange = SecurityGroupRules.portRange(permission.fromPort(), permission.toPort());
        String id = String.join(":", group.groupId(), permission.ipProtocol(), portRange, String.valueOf(cidr));
        return Resource.builder(ServiceType.SECURITY_GROUPS, SecurityGroupRules.INGRESS_ENTRY, id)
                .attribute(SecurityGroupRules.GROUP_ID, group.groupId())
                .attribute(SecurityGroupRules.GROUP_NAME, group.groupName())
                .attribute(SecurityGroupRules.PROTOCOL, permission.ipProtocol())
                .attribute(SecurityGroupRules.FROM_PORT, permission.fromPort())
                .attribute(SecurityGroupRules.TO_PORT, permission.toPort())
                .attribute(SecurityGroupRules.PORT_RANGE, portRange)
                .attribute(SecurityGroupRules.CIDR, cidr)
                .build();
    }
}
