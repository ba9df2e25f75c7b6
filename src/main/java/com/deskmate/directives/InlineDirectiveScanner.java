package com.deskmate.directives;

import com.deskmate.models.Directive;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds JSON fragments embedded in free text and lifts the directive-shaped ones out of it.
 * <p>
 * The text is walked left to right. At every '{' or '[' one JSON value is parsed greedily;
 * a failed parse only advances the cursor by one character. A parsed value that classifies
 * as one or more directives has its exact span removed from the text, any other value is
 * left in place and skipped over.
 */
public class InlineDirectiveScanner {

    private static final String SCHEMA_WRAPPER = "$schema";

    private final ObjectMapper objectMapper;
    private final boolean nameOnlyExpressions;

    public InlineDirectiveScanner(ObjectMapper objectMapper) {
        this(objectMapper, true);
    }

    /**
     * @param nameOnlyExpressions whether {"name": "..."} alone counts as an expression directive.
     *                            Prose that quotes such an object loses it from the visible text.
     */
    public InlineDirectiveScanner(ObjectMapper objectMapper, boolean nameOnlyExpressions) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.nameOnlyExpressions = nameOnlyExpressions;
    }

    public ScanResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return ScanResult.empty();
        }
        List<Directive> directives = new ArrayList<>();
        StringBuilder kept = new StringBuilder(text.length());
        int lastEnd = 0;
        int idx = 0;
        int length = text.length();

        while (idx < length) {
            char c = text.charAt(idx);
            if (c != '{' && c != '[') {
                idx++;
                continue;
            }
            ParsedSpan span = parseAt(text, idx);
            if (span == null) {
                idx++;
                continue;
            }
            List<Directive> found = classify(span.value);
            if (!found.isEmpty()) {
                kept.append(text, lastEnd, idx);
                directives.addAll(found);
                lastEnd = span.end;
            }
            idx = span.end;
        }

        kept.append(text, lastEnd, length);
        return new ScanResult(kept.toString().trim(), directives);
    }

    /**
     * Classifies an already parsed value. Sequences are flattened in order.
     */
    public List<Directive> classify(JsonNode node) {
        List<Directive> directives = new ArrayList<>();
        if (node == null) {
            return directives;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                directives.addAll(classify(item));
            }
            return directives;
        }
        if (!node.isObject()) {
            return directives;
        }
        JsonNode wrapped = node.get(SCHEMA_WRAPPER);
        if (wrapped != null) {
            directives.addAll(classify(wrapped));
        }
        Directive typed = DirectiveJson.fromTypedObject(objectMapper, node);
        if (typed != null) {
            directives.add(typed);
            return directives;
        }
        JsonNode expression = node.get("expression");
        if (expression != null && expression.isTextual()) {
            directives.add(new Directive("expression", Map.of("name", expression.asText())));
            return directives;
        }
        JsonNode name = node.get("name");
        if (nameOnlyExpressions && name != null && name.isTextual()) {
            directives.add(new Directive("expression", Map.of("name", name.asText())));
        }
        return directives;
    }

    private ParsedSpan parseAt(String text, int start) {
        try (JsonParser parser = objectMapper.createParser(text.substring(start))) {
            JsonNode value = parser.readValueAsTree();
            if (value == null) {
                return null;
            }
            long consumed = parser.currentLocation().getCharOffset();
            if (consumed <= 0) {
                return null;
            }
            return new ParsedSpan(value, start + (int) consumed);
        } catch (IOException e) {
            return null;
        }
    }

    private static final class ParsedSpan {
        private final JsonNode value;
        private final int end;

        private ParsedSpan(JsonNode value, int end) {
            this.value = value;
            this.end = end;
        }
    }
}
