package com.xammer.posture.lister;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.posture.domain.PolicyStatement;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the statements of an IAM policy document as returned by GetPolicyVersion
 * (URL-encoded JSON). Both {@code Statement} and its {@code Action}/{@code Resource}
 * fields may be a single value or an array.
 */
public class PolicyDocumentParser {

    private final ObjectMapper objectMapper;

    public PolicyDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PolicyStatement> parse(String document) {
        if (document == null || document.isBlank()) {
            return Collections.emptyList();
        }
        String json = document.trim().startsWith("{")
                ? document
                : URLDecoder.decode(document, StandardCharsets.UTF_8);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed policy document: " + e.getOriginalMessage(), e);
        }
        List<PolicyStatement> statements = new ArrayList<>();
        for (JsonNode statement : asList(root.path("Statement"))) {
            statements.add(new PolicyStatement(
                    statement.path("Effect").asText(null),
                    textValues(statement.path("Action")),
                    textValues(statement.path("Resource"))));
        }
        return statements;
    }

    private static List<JsonNode> asList(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return Collections.emptyList();
        }
        List<JsonNode> nodes = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(nodes::add);
        } else {
            nodes.add(node);
        }
        return nodes;
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : asList(node)) {
            values.add(value.asText());
        }
        return values;
    }
}
