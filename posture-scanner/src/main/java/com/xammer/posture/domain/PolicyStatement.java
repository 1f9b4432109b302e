package com.xammer.posture.domain;

import lombok.Value;

import java.util.List;

/**
 * One statement of an IAM policy document, with string-or-array fields normalised to lists.
 */
@Value
public class PolicyStatement {

    public static final String WILDCARD = "*";

    String effect;
    List<String> actions;
    List<String> resources;

    public boolean allows() {
        return "Allow".equals(effect);
    }

    /** Allow on every action over every resource. */
    public boolean isFullAdmin() {
        return allows() && actions.contains(WILDCARD) && resources.contains(WILDCARD);
    }
}
