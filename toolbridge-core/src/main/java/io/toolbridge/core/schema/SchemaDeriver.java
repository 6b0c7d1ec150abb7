package io.toolbridge.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SchemaDeriver {

    private SchemaDeriver() {
    }

    public static Map<String, Object> derive(List<String> parameters, String documentation) {
        List<String> declared = parameters == null ? List.of() : parameters;
        if (declared.size() > 1) {
            throw new SchemaDerivationException(
                "Tool handlers may declare at most one parameter, found " + declared.size() + ": " + declared
            );
        }

        List<ParameterDoc> documented = ParameterDocParser.parse(documentation);
        for (ParameterDoc doc : documented) {
            if (!declared.contains(doc.name())) {
                throw new SchemaDerivationException(
                    "Parameter '" + doc.name() + "' in MCP Parameters is not a declared handler parameter"
                );
            }
        }

        if (declared.isEmpty()) {
            return Map.of("type", "object");
        }

        String parameter = declared.get(0);
        ParameterDoc doc = documented.stream()
            .filter(entry -> entry.name().equals(parameter))
            .findFirst()
            .orElseThrow(() -> new SchemaDerivationException(
                "Handler parameter '" + parameter + "' is missing from MCP Parameters"
            ));

        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "string");
        if (doc.hasDescription()) {
            property.put("description", doc.description());
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of(parameter, Collections.unmodifiableMap(property)));
        schema.put("required", List.of(parameter));
        return Collections.unmodifiableMap(schema);
    }
}
