package com.xammer.posture.engine;

import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.FindingKind;
import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.ServiceType;
import com.xammer.posture.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleEngineTest {

    private final RuleEngine engine = new RuleEngine();

    private static Rule flagWhenTrue(String id, MissingAttributePolicy whenMissing) {
        return Rule.builder(id)
                .inspects("flag", whenMissing)
                .triggersWhen(r -> r.bool("flag").orElse(false))
                .message("{id} has flag={flag}")
                .severity(Severity.WARNING)
                .build();
    }

    private static Resource resource(Object flag) {
        return Resource.builder(ServiceType.EC2, "thing", "r-1").attribute("flag", flag).build();
    }

    @Test
    void shouldEmitOneFindingPerTriggeredRuleInRuleOrder() {
        Rule first = flagWhenTrue("first", MissingAttributePolicy.FAIL_OPEN);
        Rule never = Rule.builder("never")
                .inspects("flag", MissingAttributePolicy.FAIL_OPEN)
                .triggersWhen(r -> false)
                .message("never")
                .severity(Severity.HIGH)
                .build();
        Rule second = flagWhenTrue("second", MissingAttributePolicy.FAIL_OPEN);

        List<Finding> findings = engine.evaluate(resource(true), List.of(first, never, second));

        assertEquals(2, findings.size());
        assertEquals("first", findings.get(0).getRuleId());
        assertEquals("second", findings.get(1).getRuleId());
        Finding finding = findings.get(0);
        assertEquals(ServiceType.EC2, finding.getService());
        assertEquals("r-1", finding.getResourceId());
        assertEquals(Severity.WARNING, finding.getSeverity());
        assertEquals(FindingKind.MISCONFIGURATION, finding.getKind());
        assertEquals("r-1 has flag=true", finding.getMessage());
    }

    @Test
    void shouldReturnNothingWhenNoRuleTriggers() {
        List<Finding> findings = engine.evaluate(resource(false),
                List.of(flagWhenTrue("a", MissingAttributePolicy.FAIL_OPEN)));

        assertTrue(findings.isEmpty());
    }

    @Test
    void shouldApplyMissingAttributePolicyWithoutCallingPredicate() {
        AtomicInteger calls = new AtomicInteger();
        Rule closed = Rule.builder("closed")
                .inspects("flag", MissingAttributePolicy.FAIL_CLOSED)
                .triggersWhen(r -> calls.incrementAndGet() > 100)
                .message("{id} flag unknown ({flag})")
                .severity(Severity.HIGH)
                .build();
        Rule open = Rule.builder("open")
                .inspects("flag", MissingAttributePolicy.FAIL_OPEN)
                .triggersWhen(r -> calls.incrementAndGet() > 100)
                .message("unused")
                .severity(Severity.HIGH)
                .build();

        List<Finding> findings = engine.evaluate(resource(null), List.of(closed, open));

        assertEquals(1, findings.size());
        assertEquals("closed", findings.get(0).getRuleId());
        assertEquals("r-1 flag unknown (n/a)", findings.get(0).getMessage());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldBeDeterministicForIdenticalInput() {
        List<Rule> rules = List.of(
                flagWhenTrue("a", MissingAttributePolicy.FAIL_OPEN),
                flagWhenTrue("b", MissingAttributePolicy.FAIL_CLOSED));
        Resource resource = resource(true);

        assertEquals(engine.evaluate(resource, rules), engine.evaluate(resource, rules));
        assertEquals(engine.evaluate(resource(null), rules), engine.evaluate(resource(null), rules));
    }

    @Test
    void shouldPropagatePredicateErrors() {
        Rule broken = Rule.builder("broken")
                .inspects("flag", MissingAttributePolicy.FAIL_OPEN)
                .triggersWhen(r -> r.integer("flag").orElse(0) > 0)
                .message("broken")
                .severity(Severity.INFO)
                .build();

        assertThrows(NumberFormatException.class, () -> engine.evaluate(resource("yes"), List.of(broken)));
    }
}
