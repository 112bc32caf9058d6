package org.carball.stackcost.model.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed CloudFormation or CDK synthesized template. Resources keep their declaration order.
 */
public record CloudTemplate(
    String description,
    JsonNode metadata,
    Map<String, ResourceDeclaration> resources,
    JsonNode raw
) {

    public CloudTemplate {
        metadata = metadata == null ? MissingNode.getInstance() : metadata;
        resources = resources == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    /**
     * Resources that declare a type, in declaration order.
     */
    public List<ResourceDeclaration> typedResources() {
        return resources.values().stream()
                .filter(ResourceDeclaration::hasType)
                .toList();
    }

    public boolean hasResources() {
        return !resources.isEmpty();
    }
}
