package com.deskmate.directives;

import com.deskmate.models.Directive;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions shared by the scanner and the normalizer.
 */
final class DirectiveJson {

    static final String TYPE_FIELD = "type";
    static final String PAYLOAD_FIELD = "payload";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private DirectiveJson() {
    }

    static Map<String, Object> toMap(ObjectMapper mapper, JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    /**
     * {"type": "motion", ...} becomes a directive of that kind. The argument map is the nested
     * "payload" object when there is one, otherwise every other field.
     */
    static Directive fromTypedObject(ObjectMapper mapper, JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            return null;
        }
        JsonNode payload = node.get(PAYLOAD_FIELD);
        if (payload != null && payload.isObject()) {
            return new Directive(type.asText(), toMap(mapper, payload));
        }
        ObjectNode rest = ((ObjectNode) node).deepCopy();
        rest.remove(TYPE_FIELD);
        rest.remove(PAYLOAD_FIELD);
        return new Directive(type.asText(), toMap(mapper, rest));
    }
}
