package com.xammer.posture.engine;

import com.xammer.posture.domain.Resource;
import com.xammer.posture.domain.Severity;
import lombok.Getter;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Pure check over one resource. The predicate only runs when the required attribute
 * is present; otherwise {@link #getWhenMissing()} decides the outcome.
 */
@Getter
public final class Rule {

    private final String id;
    private final String requiredAttribute;
    private final MissingAttributePolicy whenMissing;
    private final Predicate<Resource> predicate;
    private final MessageTemplate messageTemplate;
    private final Severity severity;

    private Rule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.requiredAttribute = Objects.requireNonNull(builder.requiredAttribute, "requiredAttribute");
        this.whenMissing = Objects.requireNonNull(builder.whenMissing, "whenMissing for rule " + builder.id);
        this.predicate = Objects.requireNonNull(builder.predicate, "predicate");
        this.messageTemplate = Objects.requireNonNull(builder.messageTemplate, "messageTemplate");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * @return true when the resource violates this rule
     */
    public boolean triggers(Resource resource) {
        if (!resource.has(requiredAttribute)) {
            return whenMissing == MissingAttributePolicy.FAIL_CLOSED;
        }
        return predicate.test(resource);
    }

    @Override
    public String toString() {
        return id + "[" + severity + ", " + requiredAttribute + " missing=" + whenMissing + "]";
    }

    public static final class Builder {
        private final String id;
        private String requiredAttribute;
        private MissingAttributePolicy whenMissing;
        private Predicate<Resource> predicate;
        private MessageTemplate messageTemplate;
        private Severity severity;

        private Builder(String id) {
            this.id = id;
        }

        public Builder inspects(String attribute, MissingAttributePolicy whenMissing) {
            this.requiredAttribute = attribute;
            this.whenMissing = whenMissing;
            return this;
        }

        public Builder triggersWhen(Predicate<Resource> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder message(String template) {
            this.messageTemplate = MessageTemplate.of(template);
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Rule build() {
            return new Rule(this);
        }
    }
}
