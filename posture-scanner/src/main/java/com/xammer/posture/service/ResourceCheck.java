package com.xammer.posture.service;

import com.xammer.posture.engine.Rule;
import com.xammer.posture.lister.ResourceLister;
import lombok.Value;

import java.util.List;

/**
 * One resource kind of a service paired with the rule table applied to it.
 */
@Value
public class ResourceCheck {
    String name;
    ResourceLister lister;
    List<Rule> rules;
}
