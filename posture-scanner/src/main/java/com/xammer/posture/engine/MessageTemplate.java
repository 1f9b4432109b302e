package com.xammer.posture.engine;

import com.xammer.posture.domain.Resource;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finding message with {@code {placeholder}} slots. {@code {id}} is the resource id,
 * any other name is looked up as a resource attribute.
 */
public final class MessageTemplate {

    static final String MISSING_VALUE = "n/a";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9_]*)}");

    private final String template;

    private MessageTemplate(String template) {
        this.template = template;
    }

    public static MessageTemplate of(String template) {
        return new MessageTemplate(template);
    }

    public String render(Resource resource) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = "id".equals(name)
                    ? resource.getId()
                    : resource.string(name).orElse(MISSING_VALUE);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    @Override
    public String toString() {
        return template;
    }
}
