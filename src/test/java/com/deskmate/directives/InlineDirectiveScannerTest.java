package com.deskmate.directives;

import com.deskmate.models.Directive;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InlineDirectiveScannerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InlineDirectiveScanner scanner = new InlineDirectiveScanner(mapper);

    @Test
    void extractsTypedDirectiveAndKeepsSurroundingText() {
        ScanResult result = scanner.scan("hello {\"type\":\"motion\",\"group\":\"Idle\"} world");

        assertEquals("hello  world", result.getCleanedText());
        assertEquals(1, result.getDirectives().size());
        Directive directive = result.getDirectives().get(0);
        assertEquals("motion", directive.getKind());
        assertEquals("Idle", directive.get("group"));
        assertFalse(directive.getPayload().containsKey("type"));
    }

    @Test
    void nestedPayloadObjectBecomesThePayload() {
        ScanResult result = scanner.scan("{\"type\":\"scale\",\"payload\":{\"value\":1.5},\"note\":\"x\"}");

        assertEquals("", result.getCleanedText());
        Directive directive = result.getDirectives().get(0);
        assertEquals("scale", directive.getKind());
        assertEquals(1, directive.getPayload().size());
        assertEquals(1.5, ((Number) directive.get("value")).doubleValue());
    }

    @Test
    void nonDirectiveJsonIsPreserved() {
        String text = "config is {\"a\": 1} and list [1, 2, 3]";
        ScanResult result = scanner.scan(text);

        assertEquals(text, result.getCleanedText());
        assertTrue(result.getDirectives().isEmpty());
    }

    @Test
    void cleaningIsIdempotent() {
        String text = "Sure! {\"type\":\"motion\",\"group\":\"Tap\"} [{\"expression\":\"happy\"}] done {\"k\":2}";
        ScanResult first = scanner.scan(text);
        ScanResult second = scanner.scan(first.getCleanedText());

        assertEquals(first.getCleanedText(), second.getCleanedText());
        assertTrue(second.getDirectives().isEmpty());
        assertEquals(2, first.getDirectives().size());
    }

    @Test
    void arraysAreFlattenedInOrder() {
        ScanResult result = scanner.scan("[{\"type\":\"move\",\"dx\":5}, {\"expression\":\"sad\"}, {\"type\":\"look\",\"x\":1,\"y\":2}]");

        List<Directive> directives = result.getDirectives();
        assertEquals(3, directives.size());
        assertEquals("move", directives.get(0).getKind());
        assertEquals("expression", directives.get(1).getKind());
        assertEquals("sad", directives.get(1).get("name"));
        assertEquals("look", directives.get(2).getKind());
        assertEquals("", result.getCleanedText());
    }

    @Test
    void schemaWrapperIsUnwrapped() {
        ScanResult result = scanner.scan("ok {\"$schema\": {\"type\":\"motion\",\"group\":\"Idle\"}}");

        assertEquals("ok", result.getCleanedText());
        assertEquals(1, result.getDirectives().size());
        assertEquals("motion", result.getDirectives().get(0).getKind());
    }

    @Test
    void nameOnlyObjectsCanBeLeftInText() {
        InlineDirectiveScanner strict = new InlineDirectiveScanner(mapper, false);
        String text = "the user {\"name\":\"Alice\"} said hi";

        assertEquals(text, strict.scan(text).getCleanedText());
        ScanResult lenient = scanner.scan(text);
        assertEquals(1, lenient.getDirectives().size());
        assertEquals("Alice", lenient.getDirectives().get(0).get("name"));
    }

    @Test
    void malformedJsonIsSkippedCharacterByCharacter() {
        ScanResult result = scanner.scan("broken { \"type\": } then {\"type\":\"face\",\"name\":\"happy\"}");

        assertEquals("broken { \"type\": } then", result.getCleanedText());
        assertEquals(1, result.getDirectives().size());
        assertEquals("face", result.getDirectives().get(0).getKind());
    }

    @Test
    void emptyInputYieldsNothing() {
        ScanResult result = scanner.scan("");
        assertEquals("", result.getCleanedText());
        assertTrue(result.getDirectives().isEmpty());
        assertFalse(scanner.scan(null).hasDirectives());
    }
}
