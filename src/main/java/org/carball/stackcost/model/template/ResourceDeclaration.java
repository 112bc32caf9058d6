package org.carball.stackcost.model.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One entry of a template's {@code Resources} section.
 *
 * @param logicalId  the key the resource is declared under, unique within a template
 * @param type       the declared type, e.g. {@code AWS::Lambda::Function}; null when absent
 * @param properties the free-form {@code Properties} object, never null
 */
public record ResourceDeclaration(String logicalId, String type, JsonNode properties) {

    private static final String SEGMENT_SEPARATOR = "::";

    public ResourceDeclaration {
        if (properties == null || !properties.isObject()) {
            properties = JsonNodeFactory.instance.objectNode();
        }
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }

    public boolean isType(String candidate) {
        return hasType() && type.equals(candidate);
    }

    /**
     * The service part of {@code <vendor>::<service>::<kind>}. A type with no separator is its own segment.
     */
    public String serviceSegment() {
        return serviceSegmentOf(type);
    }

    public JsonNode property(String name) {
        return properties.path(name);
    }

    public boolean hasProperty(String name) {
        return properties.hasNonNull(name);
    }

    public static String serviceSegmentOf(String type) {
        if (type == null) {
            return null;
        }
        String[] parts = type.split(SEGMENT_SEPARATOR);
        if (parts.length >= 2 && !parts[1].isBlank()) {
            return parts[1];
        }
        return type;
    }
}
