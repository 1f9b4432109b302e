package com.xammer.posture.lister;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.posture.domain.PolicyStatement;
import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyDocumentParserTest {

    private final PolicyDocumentParser parser = new PolicyDocumentParser(new ObjectMapper());

    @Test
    void shouldDecodeUrlEncodedDocumentWithStatementArray() {
        String json = "{\"Version\":\"2012-10-17\",\"Statement\":["
                + "{\"Effect\":\"Allow\",\"Action\":\"*\",\"Resource\":\"*\"},"
                + "{\"Effect\":\"Allow\",\"Action\":[\"s3:GetObject\",\"s3:PutObject\"],\"Resource\":[\"arn:aws:s3:::b/*\"]}]}";

        List<PolicyStatement> statements = parser.parse(URLEncoder.encode(json, StandardCharsets.UTF_8));

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).isFullAdmin());
        assertEquals(List.of("s3:GetObject", "s3:PutObject"), statements.get(1).getActions());
        assertFalse(statements.get(1).isFullAdmin());
    }

    @Test
    void shouldAcceptSingleStatementObject() {
        String json = "{\"Statement\":{\"Effect\":\"Allow\",\"Action\":[\"*\"],\"Resource\":\"*\"}}";

        List<PolicyStatement> statements = parser.parse(json);

        assertEquals(1, statements.size());
        assertTrue(statements.get(0).isFullAdmin());
    }

    @Test
    void shouldReturnNoStatementsForEmptyDocument() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("{\"Version\":\"2012-10-17\"}").isEmpty());
    }

    @Test
    void shouldRejectMalformedDocument() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"Statement\":["));
    }
}
