package com.clawd.core.provider;

import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks shared by every adapter before a tool declaration is translated.
 */
final class ToolSchemas {

    private static final Pattern TOOL_NAME = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private ToolSchemas() {
    }

    /**
     * Validate the declarations and return each tool's parameter schema, defaulting a missing
     * schema to an empty object schema.
     *
     * @throws UnsupportedCapabilityException for names or schemas the provider cannot express
     */
    static List<ObjectNode> parameterSchemas(String provider, List<ToolDefinition> tools, ObjectMapper mapper) {
        Set<String> seen = new HashSet<>();
        return tools.stream().map(tool -> {
            String name = tool.getName();
            if (name == null || !TOOL_NAME.matcher(name).matches()) {
                throw new UnsupportedCapabilityException(provider, "tool name",
                        "'" + name + "' must match " + TOOL_NAME.pattern());
            }
            if (!seen.add(name)) {
                throw new UnsupportedCapabilityException(provider, "duplicate tool names", name);
            }
            return objectSchema(provider, tool, mapper);
        }).toList();
    }

    private static ObjectNode objectSchema(String provider, ToolDefinition tool, ObjectMapper mapper) {
        JsonNode parameters = tool.getParameters();
        if (parameters == null || parameters.isNull()) {
            ObjectNode empty = mapper.createObjectNode();
            empty.put("type", "object");
            empty.set("properties", mapper.createObjectNode());
            return empty;
        }
        if (!parameters.isObject()) {
            throw new UnsupportedCapabilityException(provider, "tool parameters",
                    "schema of '" + tool.getName() + "' is not a JSON object");
        }
        JsonNode type = parameters.get("type");
        if (type != null && !"object".equals(type.asText())) {
            throw new UnsupportedCapabilityException(provider, "tool parameters",
                    "schema of '" + tool.getName() + "' has type '" + type.asText() + "', only 'object' is supported");
        }
        ObjectNode schema = ((ObjectNode) parameters).deepCopy();
        if (type == null) {
            schema.put("type", "object");
        }
        return schema;
    }
}
