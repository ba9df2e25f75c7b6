package com.deskmate.directives;

import com.deskmate.models.Directive;
import com.deskmate.models.ResponseStatus;
import com.deskmate.models.StructuredResponse;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw chat backend payload into reply text plus directives.
 * <p>
 * Accepted shapes: an OpenAI-style completion ({@code choices[0].message}, with optional
 * {@code tool_calls}), a simple {@code {reply|content|message}} object, either of those wrapped
 * in a JSON string, a bare string, or an array. Provider-native directives come first, then
 * whatever the inline scanner finds in the reply text.
 */
public class ResponseNormalizer {

    public static final String DIRECTIVES_ONLY_PLACEHOLDER = "(directives applied)";
    public static final String EMPTY_REPLY_PLACEHOLDER = "(the chat service returned no content)";
    /** Key under which undecodable tool-call arguments are kept. */
    public static final String RAW_ARGUMENTS_KEY = "raw";

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final InlineDirectiveScanner scanner;

    public ResponseNormalizer(ObjectMapper objectMapper, InlineDirectiveScanner scanner) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.strictReader = this.objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.scanner = scanner != null ? scanner : new InlineDirectiveScanner(this.objectMapper);
    }

    public StructuredResponse normalize(String rawText) {
        return normalize(rawText == null ? null : TextNode.valueOf(rawText));
    }

    public StructuredResponse normalize(JsonNode raw) {
        JsonNode data = raw;
        String text = "";
        List<Directive> directives = new ArrayList<>();
        JsonNode rawMessage = null;

        if (data != null && data.isTextual()) {
            String value = data.asText().trim();
            JsonNode parsed = value.startsWith("{") ? parseObject(value) : null;
            if (parsed != null) {
                data = parsed;
            } else {
                text = value;
            }
        }

        if (data != null && data.isObject()) {
            JsonNode choices = data.path("choices");
            if (choices.isArray() && choices.size() > 0) {
                JsonNode message = choices.get(0).path("message");
                if (message.isObject()) {
                    rawMessage = message;
                    text = contentText(message.get("content"));
                    directives.addAll(extractToolCalls(message));
                }
            }

            if (text.isEmpty()) {
                text = firstText(data, "reply", "content", "message");
            }

            if (directives.isEmpty()) {
                directives.addAll(convertCommandList(data.get("commands")));
            }

            // Some providers wrap a whole JSON reply object inside the content string.
            if (text.startsWith("{")) {
                JsonNode inner = parseObject(text);
                if (inner != null) {
                    if (hasAny(inner, "reply", "content", "text", "commands")) {
                        text = firstText(inner, "reply", "content", "text");
                    }
                    if (directives.isEmpty()) {
                        directives.addAll(convertCommandList(inner.get("commands")));
                    }
                }
            }
        } else if (data != null && data.isArray() && data.size() > 0) {
            JsonNode first = data.get(0);
            text = first.isValueNode() ? first.asText() : first.toString();
        }

        ScanResult scanned = scanner.scan(text);
        directives.addAll(scanned.getDirectives());
        text = scanned.getCleanedText();

        if (text.isEmpty()) {
            text = directives.isEmpty() ? EMPTY_REPLY_PLACEHOLDER : DIRECTIVES_ONLY_PLACEHOLDER;
        }

        return new StructuredResponse(text, directives, ResponseStatus.OK, null,
            rawMessage != null ? rawMessage : raw);
    }

    /**
     * OpenAI tool calls, plus the older single {@code function_call} form.
     */
    List<Directive> extractToolCalls(JsonNode message) {
        List<Directive> directives = new ArrayList<>();
        JsonNode toolCalls = message.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray()) {
            for (JsonNode call : toolCalls) {
                Directive directive = fromFunction(call.path("function"));
                if (directive != null) {
                    directives.add(directive);
                }
            }
        }
        if (directives.isEmpty()) {
            Directive legacy = fromFunction(message.path("function_call"));
            if (legacy != null) {
                directives.add(legacy);
            }
        }
        return directives;
    }

    private Directive fromFunction(JsonNode function) {
        if (function == null || !function.isObject()) {
            return null;
        }
        JsonNode name = function.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            return null;
        }
        return new Directive(name.asText(), decodeArguments(function.get("arguments")));
    }

    private Map<String, Object> decodeArguments(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (arguments.isObject()) {
            return DirectiveJson.toMap(objectMapper, arguments);
        }
        if (arguments.isTextual()) {
            String value = arguments.asText();
            if (value.isBlank()) {
                return Map.of();
            }
            JsonNode decoded = parseObject(value.trim());
            if (decoded != null) {
                return DirectiveJson.toMap(objectMapper, decoded);
            }
            return Map.of(RAW_ARGUMENTS_KEY, value);
        }
        return Map.of(RAW_ARGUMENTS_KEY, arguments.toString());
    }

    private List<Directive> convertCommandList(JsonNode commands) {
        List<Directive> directives = new ArrayList<>();
        if (commands == null || !commands.isArray()) {
            return directives;
        }
        for (JsonNode item : commands) {
            Directive directive = DirectiveJson.fromTypedObject(objectMapper, item);
            if (directive != null) {
                directives.add(directive);
            }
        }
        return directives;
    }

    /**
     * The whole string must be one JSON object; text after the closing brace makes it plain text.
     */
    private JsonNode parseObject(String value) {
        try {
            JsonNode node = strictReader.readTree(value);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Message content is a string, or (multimodal providers) an array of {type: text, text} parts.
     */
    private String contentText(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                JsonNode partText = part.isTextual() ? part : part.get("text");
                if (partText != null && partText.isTextual()) {
                    sb.append(partText.asText());
                }
            }
            return sb.toString().trim();
        }
        return content.isValueNode() ? content.asText().trim() : "";
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    private boolean hasAny(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.has(field)) {
                return true;
            }
        }
        return false;
    }
}
