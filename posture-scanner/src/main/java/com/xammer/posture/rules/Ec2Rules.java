package com.xammer.posture.rules;

import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;

public final class Ec2Rules {

    public static final String INSTANCE = "instance";

    public static final String PUBLIC_IP = "publicIp";
    public static final String STATE = "state";

    // No reported address means no evidence of exposure.
    public static final Rule PUBLIC_IP_ASSIGNED = Rule.builder("ec2-public-ip")
            .inspects(PUBLIC_IP, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> r.string(PUBLIC_IP).filter(ip -> !ip.isBlank()).isPresent())
            .message("EC2 instance {id} has a public IP address assigned: {publicIp}")
            .severity(Severity.WARNING)
            .build();

    public static final List<Rule> INSTANCE_RULES = List.of(PUBLIC_IP_ASSIGNED);

    private Ec2Rules() {
    }
}
