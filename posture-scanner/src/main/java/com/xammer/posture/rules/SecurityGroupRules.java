package com.xammer.posture.rules;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.Severity;
import com.xammer.posture.engine.MissingAttributePolicy;
import com.xammer.posture.engine.Rule;

import java.util.List;
import java.util.Set;

/**
 * Ingress checks. Each resource is one (security group, permission, CIDR) entry.
 */
public final class SecurityGroupRules {

    public static final String INGRESS_ENTRY = "ingress-entry";

    public static final Set<String> WORLD_CIDRS = Set.of("0.0.0.0/0", "::/0");
    public static final List<Integer> DANGEROUS_PORTS = List.of(22, 3389, 3306, 5432, 80, 443);
    public static final String ALL_PORTS = "All Ports";
    private static final Set<String> ICMP_PROTOCOLS = Set.of("icmp", "icmpv6", "1", "58");

    public static final String GROUP_ID = "groupId";
    public static final String GROUP_NAME = "groupName";
    public static final String PROTOCOL = "protocol";
    public static final String FROM_PORT = "fromPort";
    public static final String TO_PORT = "toPort";
    public static final String PORT_RANGE = "portRange";
    public static final String CIDR = "cidr";

    public static final Rule OPEN_TO_WORLD = Rule.builder("sg-open-to-world")
            .inspects(CIDR, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(SecurityGroupRules::isWorldOpen)
            .message("Security group {groupId}: ports {portRange} open to the world ({cidr})")
            .severity(Severity.WARNING)
            .build();

    public static final Rule DANGEROUS_PORT_OPEN = Rule.builder("sg-dangerous-port-open")
            .inspects(CIDR, MissingAttributePolicy.FAIL_OPEN)
            .triggersWhen(r -> isWorldOpen(r) && exposesDangerousPort(r))
            .message("Security group {groupId}: sensitive port in range {portRange} open to the world ({cidr})")
            .severity(Severity.HIGH)
            .build();

    public static final List<Rule> INGRESS_RULES = List.of(OPEN_TO_WORLD, DANGEROUS_PORT_OPEN);

    private SecurityGroupRules() {
    }

    static boolean isWorldOpen(Resource entry) {
        return entry.string(CIDR).map(WORLD_CIDRS::contains).orElse(false);
    }

    /**
     * Missing ports, or a -1 port, mean the permission covers every port.
     */
    static boolean exposesDangerousPort(Resource entry) {
        if (entry.string(PROTOCOL).map(p -> ICMP_PROTOCOLS.contains(p.toLowerCase())).orElse(false)) {
            return false;
        }
        int from = entry.integer(FROM_PORT).orElse(-1);
        int to = entry.integer(TO_PORT).orElse(-1);
        if (from < 0 || to < 0) {
            return true;
        }
        return DANGEROUS_PORTS.stream().anyMatch(port -> port >= from && port <= to);
    }

    public static String portRange(Integer from, Integer to) {
        if (from == null || to == null || from < 0 || to < 0) {
            return ALL_PORTS;
        }
        return from + "-" + to;
    }
}
