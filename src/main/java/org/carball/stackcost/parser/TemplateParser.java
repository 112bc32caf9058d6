package org.carball.stackcost.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.template.ResourceDeclaration;
import org.carball.stackcost.model.template.TemplateFormat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses template documents and extracts their resources.
 */
@Slf4j
public class TemplateParser {

    public static final String UNKNOWN_STACK_NAME = "Unknown CDK Stack";

    private static final Pattern DESCRIPTION_STACK_NAME = Pattern.compile("for (.*?) Stack");

    // A template must be exactly one document; anything after it is a parse error
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    private final ObjectMapper yamlMapper = YAMLMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    public CloudTemplate parse(String content) throws TemplateParseException {
        return parse(content, TemplateFormat.JSON);
    }

    public CloudTemplate parse(String content, TemplateFormat format) throws TemplateParseException {
        if (content == null || content.isBlank()) {
            throw new TemplateParseException("Template is empty");
        }

        JsonNode root;
        try {
            ObjectMapper mapper = format == TemplateFormat.YAML ? yamlMapper : jsonMapper;
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new TemplateParseException("Invalid " + format + " template: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new TemplateParseException("Template root must be an object");
        }
        return fromTree(root);
    }

    /**
     * Builds a template from an already parsed document.
     */
    public CloudTemplate fromTree(JsonNode root) {
        Map<String, ResourceDeclaration> resources = new LinkedHashMap<>();
        JsonNode resourcesNode = root.path("Resources");

        if (resourcesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = resourcesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode declaration = field.getValue();
                JsonNode typeNode = declaration.path("Type");
                String type = typeNode.isTextual() ? typeNode.asText() : null;
                if (type == null) {
                    log.debug("Resource {} declares no type and will not be classified", field.getKey());
                }
                resources.put(field.getKey(),
                        new ResourceDeclaration(field.getKey(), type, declaration.path("Properties")));
            }
        } else {
            log.debug("Template has no Resources section");
        }

        JsonNode descriptionNode = root.path("Description");
        String description = descriptionNode.isTextual() ? descriptionNode.asText() : null;

        return new CloudTemplate(description, root.path("Metadata"), resources, root);
    }

    /**
     * Groups typed resources by their declared type. Untyped resources are left out.
     */
    public Map<String, List<ResourceDeclaration>> groupByType(CloudTemplate template) {
        Map<String, List<ResourceDeclaration>> groups = new LinkedHashMap<>();
        for (ResourceDeclaration resource : template.typedResources()) {
            groups.computeIfAbsent(resource.type(), type -> new ArrayList<>()).add(resource);
        }
        return groups;
    }

    public Map<String, Integer> countResourcesByType(CloudTemplate template) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        groupByType(template).forEach((type, resources) -> counts.put(type, resources.size()));
        return counts;
    }

    /**
     * Picks a display name: the override, a name in the description, {@code Metadata.StackName},
     * then {@link #UNKNOWN_STACK_NAME}.
     */
    public String resolveStackName(CloudTemplate template, String nameOverride) {
        if (nameOverride != null && !nameOverride.isBlank()) {
            return nameOverride;
        }

        String description = template.description();
        if (description != null && description.contains("Stack")) {
            Matcher matcher = DESCRIPTION_STACK_NAME.matcher(description);
            if (matcher.find() && !matcher.group(1).isBlank()) {
                return matcher.group(1);
            }
        }

        JsonNode stackName = template.metadata().path("StackName");
        if (stackName.isTextual() && !stackName.asText().isBlank()) {
            return stackName.asText();
        }

        return UNKNOWN_STACK_NAME;
    }
}
