package com.xammer.posture.engine;

import com.xammer.posture.domain.Finding;
import com.xammer.posture.domain.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a rule table to a single resource. Stateless and free of I/O, so one
 * instance is shared by every scanner.
 */
public class RuleEngine {

    /**
     * Evaluates {@code rules} in list order against {@code resource}.
     *
     * @return one finding per triggered rule, in rule order
     */
    public List<Finding> evaluate(Resource resource, List<Rule> rules) {
        List<Finding> findings = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.triggers(resource)) {
                findings.add(Finding.misconfiguration(
                        resource.getService(),
                        resource.getId(),
                        rule.getId(),
                        rule.getSeverity(),
                        rule.getMessageTemplate().render(resource)));
            }
        }
        return findings;
    }
}
