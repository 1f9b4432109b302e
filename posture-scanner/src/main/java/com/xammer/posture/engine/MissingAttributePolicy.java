package com.xammer.posture.engine;

/**
 * What a rule concludes when the attribute it inspects was not reported.
 */
public enum MissingAttributePolicy {
    /** Unknown is treated as unsafe and produces a finding. */
    FAIL_CLOSED,
    /** Absence of evidence is not a finding. */
    FAIL_OPEN
}
