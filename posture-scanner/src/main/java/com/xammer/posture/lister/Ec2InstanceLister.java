package com.xammer.posture.lister;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.rules.Ec2Rules;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Instance;

import java.util.stream.Stream;

public class Ec2InstanceLister implements ResourceLister {

    private final Ec2Client ec2;

    public Ec2InstanceLister(Ec2Client ec2) {
        this.ec2 = ec2;
    }

    @Override
    public Stream<Resource> list() {
        return ec2.describeInstancesPaginator().reservations().stream()
                .flatMap(reservation -> reservation.instances().stream())
                .map(Ec2InstanceLister::toResource);
    }

    static Resource toResource(Instance instance) {
        return Resource.builder(ServiceType.EC2, Ec2Rules.INSTANCE, instance.instanceId())
                .attribute(Ec2Rules.PUBLIC_IP, instance.publicIpAddress())
                .attribute(Ec2Rules.STATE, instance.state() == null ? null : instance.state().nameAsString())
                .build();
    }
}
